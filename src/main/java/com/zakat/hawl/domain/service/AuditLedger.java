package com.zakat.hawl.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zakat.hawl.domain.exception.AuditWriteFailureException;
import com.zakat.hawl.domain.model.AuditChange;
import com.zakat.hawl.domain.model.AuditEventType;
import com.zakat.hawl.domain.model.AuditIntegrityReport;
import com.zakat.hawl.domain.model.AuditTrailEntryView;
import com.zakat.hawl.infrastructure.persistence.entity.AuditTrailEntryEntity;
import com.zakat.hawl.infrastructure.persistence.repository.AuditTrailEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Append-only ledger of record lifecycle events.
 *
 * Appends only join an existing transaction, so an entry is committed if and only if
 * the transition it describes is. Within a record, entries carry a gapless sequence
 * number and timestamps that never go backwards.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditLedger {

    private static final Map<AuditEventType, Set<AuditEventType>> ALLOWED_NEXT = new EnumMap<>(AuditEventType.class);

    static {
        ALLOWED_NEXT.put(AuditEventType.CREATED,
                EnumSet.of(AuditEventType.FINALIZED, AuditEventType.INTERRUPTED, AuditEventType.DELETED));
        ALLOWED_NEXT.put(AuditEventType.FINALIZED, EnumSet.of(AuditEventType.UNLOCKED));
        ALLOWED_NEXT.put(AuditEventType.REFINALIZED, EnumSet.of(AuditEventType.UNLOCKED));
        ALLOWED_NEXT.put(AuditEventType.UNLOCKED, EnumSet.of(AuditEventType.EDITED, AuditEventType.REFINALIZED));
        ALLOWED_NEXT.put(AuditEventType.EDITED, EnumSet.of(AuditEventType.EDITED, AuditEventType.REFINALIZED));
        ALLOWED_NEXT.put(AuditEventType.INTERRUPTED, EnumSet.noneOf(AuditEventType.class));
        ALLOWED_NEXT.put(AuditEventType.DELETED, EnumSet.noneOf(AuditEventType.class));
    }

    private final AuditTrailEntryRepository auditRepository;
    private final EncryptionService encryptionService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Append one entry to a record's trail.
     *
     * @param unlockReason plaintext justification, only for {@link AuditEventType#UNLOCKED}; stored encrypted
     * @throws AuditWriteFailureException if the entry cannot be written; the caller's transaction rolls back
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AuditTrailEntryEntity append(UUID recordId, UUID userId, AuditEventType eventType,
                                        AuditChange change, String unlockReason) {
        try {
            Optional<AuditTrailEntryEntity> last = auditRepository.findFirstByRecordIdOrderBySequenceNumberDesc(recordId);

            Instant now = clock.instant();
            Instant timestamp = last.map(AuditTrailEntryEntity::getTimestamp)
                    .filter(previous -> previous.isAfter(now))
                    .orElse(now);

            AuditTrailEntryEntity entry = AuditTrailEntryEntity.builder()
                    .entryId(UUID.randomUUID())
                    .recordId(recordId)
                    .userId(userId)
                    .sequenceNumber(last.map(e -> e.getSequenceNumber() + 1).orElse(1L))
                    .eventType(eventType)
                    .timestamp(timestamp)
                    .changeSummaryEncrypted(encryptionService.encrypt(objectMapper.writeValueAsString(change)))
                    .unlockReasonEncrypted(encryptionService.encrypt(unlockReason))
                    .build();

            AuditTrailEntryEntity saved = auditRepository.saveAndFlush(entry);
            log.debug("Appended {} entry #{} for record {}", eventType, saved.getSequenceNumber(), recordId);
            return saved;

        } catch (DataAccessException | JsonProcessingException | IllegalStateException e) {
            log.error("Audit append failed for record {} ({}): {}", recordId, eventType, e.getMessage());
            throw new AuditWriteFailureException(recordId, e);
        }
    }

    @Transactional(readOnly = true)
    public List<AuditTrailEntryView> listForRecord(UUID recordId) {
        return auditRepository.findByRecordIdOrderBySequenceNumberAsc(recordId).stream()
                .map(this::toView)
                .collect(Collectors.toList());
    }

    /**
     * Owner of a record's trail. Works after the record itself has been removed.
     */
    @Transactional(readOnly = true)
    public Optional<UUID> ownerOf(UUID recordId) {
        return auditRepository.findFirstByRecordIdOrderBySequenceNumberDesc(recordId)
                .map(AuditTrailEntryEntity::getUserId);
    }

    /**
     * Replay a record's trail and report anything that a legal lifecycle cannot produce:
     * timestamps going backwards, sequence gaps, illegal event orderings, or more
     * (re)finalizations than unlocks allow.
     */
    @Transactional(readOnly = true)
    public AuditIntegrityReport verify(UUID recordId) {
        List<AuditTrailEntryEntity> entries = auditRepository.findByRecordIdOrderBySequenceNumberAsc(recordId);
        AuditIntegrityReport report = AuditIntegrityReport.builder()
                .recordId(recordId)
                .totalEvents(entries.size())
                .build();

        if (entries.isEmpty()) {
            return report;
        }

        report.setEarliest(entries.get(0).getTimestamp());
        report.setLatest(entries.get(entries.size() - 1).getTimestamp());

        AuditTrailEntryEntity previous = null;
        int locks = 0;
        int unlocks = 0;

        for (AuditTrailEntryEntity entry : entries) {
            report.getEventCounts().merge(entry.getEventType(), 1, Integer::sum);

            if (previous == null) {
                if (entry.getEventType() != AuditEventType.CREATED) {
                    report.getAnomalies().add("Trail starts with " + entry.getEventType() + " instead of CREATED");
                }
                if (entry.getSequenceNumber() != 1) {
                    report.getAnomalies().add("Trail starts at sequence " + entry.getSequenceNumber());
                }
            } else {
                if (entry.getSequenceNumber() != previous.getSequenceNumber() + 1) {
                    report.getAnomalies().add(String.format("Sequence gap between #%d and #%d",
                            previous.getSequenceNumber(), entry.getSequenceNumber()));
                }
                if (entry.getTimestamp().isBefore(previous.getTimestamp())) {
                    report.getAnomalies().add(String.format("Entry #%d is timestamped before entry #%d",
                            entry.getSequenceNumber(), previous.getSequenceNumber()));
                }
                if (!ALLOWED_NEXT.get(previous.getEventType()).contains(entry.getEventType())) {
                    report.getAnomalies().add(String.format("Illegal sequence %s -> %s at entry #%d",
                            previous.getEventType(), entry.getEventType(), entry.getSequenceNumber()));
                }
            }

            if (entry.getEventType() == AuditEventType.FINALIZED || entry.getEventType() == AuditEventType.REFINALIZED) {
                locks++;
            } else if (entry.getEventType() == AuditEventType.UNLOCKED) {
                unlocks++;
            }
            previous = entry;
        }

        if (locks > unlocks + 1) {
            report.getAnomalies().add(String.format("%d finalizations for %d unlocks", locks, unlocks));
        }

        if (!report.isClean()) {
            log.warn("Audit trail for record {} has {} anomalies", recordId, report.getAnomalies().size());
        }
        return report;
    }

    private AuditTrailEntryView toView(AuditTrailEntryEntity entry) {
        return AuditTrailEntryView.builder()
                .entryId(entry.getEntryId())
                .recordId(entry.getRecordId())
                .sequenceNumber(entry.getSequenceNumber())
                .eventType(entry.getEventType())
                .timestamp(entry.getTimestamp())
                .change(readChange(entry))
                .unlockReason(encryptionService.decrypt(entry.getUnlockReasonEncrypted()))
                .build();
    }

    private AuditChange readChange(AuditTrailEntryEntity entry) {
        String json = encryptionService.decrypt(entry.getChangeSummaryEncrypted());
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, AuditChange.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable change summary on audit entry " + entry.getEntryId(), e);
        }
    }
}
