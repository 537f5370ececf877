package com.zakat.hawl.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zakat.hawl.domain.exception.DuplicateOpenWindowException;
import com.zakat.hawl.domain.exception.InsufficientJustificationException;
import com.zakat.hawl.domain.exception.InvalidTransitionException;
import com.zakat.hawl.domain.exception.RecordNotFoundException;
import com.zakat.hawl.domain.exception.RecordValidationException;
import com.zakat.hawl.domain.model.AssetCategory;
import com.zakat.hawl.domain.model.AuditEventType;
import com.zakat.hawl.domain.model.FieldChange;
import com.zakat.hawl.domain.model.FinancialState;
import com.zakat.hawl.domain.model.NisabBasis;
import com.zakat.hawl.domain.model.RecordCreatedChange;
import com.zakat.hawl.domain.model.RecordEdit;
import com.zakat.hawl.domain.model.RecordEditedChange;
import com.zakat.hawl.domain.model.RecordLifecycleEvent;
import com.zakat.hawl.domain.model.RecordLockedChange;
import com.zakat.hawl.domain.model.RecordStatus;
import com.zakat.hawl.domain.model.StatusChange;
import com.zakat.hawl.domain.model.WealthSnapshot;
import com.zakat.hawl.domain.model.WindowInterruptedChange;
import com.zakat.hawl.infrastructure.persistence.entity.NisabYearRecordEntity;
import com.zakat.hawl.infrastructure.persistence.entity.OutboxEventEntity;
import com.zakat.hawl.infrastructure.persistence.repository.NisabYearRecordRepository;
import com.zakat.hawl.infrastructure.persistence.repository.OutboxEventRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * State machine for Nisab year records.
 *
 * <pre>
 *   DRAFT --finalize--> FINALIZED --unlock--> UNLOCKED --finalize--> FINALIZED
 *     |                                          |
 *     +--delete / interrupt--> (removed)         +--edit--> UNLOCKED
 * </pre>
 *
 * Every transition runs in one transaction that also appends exactly one audit entry
 * and one outbox event; if either write fails the whole transition rolls back.
 * The record row is locked for the duration, which serializes a user's finalize
 * against the detection job's interruption of the same draft.
 *
 * Rejections are validated before anything is written and are returned as
 * {@link LifecycleOutcome#rejected}, never thrown to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecordLifecycle {

    static final BigDecimal ZAKAT_RATE = new BigDecimal("0.025");
    static final int MIN_UNLOCK_REASON_LENGTH = 10;
    static final int MAX_UNLOCK_REASON_LENGTH = 500;

    private static final TypeReference<Map<AssetCategory, BigDecimal>> BREAKDOWN_TYPE = new TypeReference<>() {
    };

    private final NisabYearRecordRepository recordRepository;
    private final OutboxEventRepository outboxEventRepository;
    private final AuditLedger auditLedger;
    private final EncryptionService encryptionService;
    private final HawlCalendar hawlCalendar;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * 2.5% of wealth above the threshold, never negative.
     */
    public static BigDecimal computeObligation(BigDecimal wealth, BigDecimal threshold) {
        BigDecimal excess = wealth.subtract(threshold);
        if (excess.signum() <= 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return excess.multiply(ZAKAT_RATE).setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Open a new observation window.
     *
     * @param wealthAtStart wealth that triggered the window, recorded in the audit entry only; may be null
     */
    @Transactional
    public LifecycleOutcome create(UUID userId, LocalDate hawlStart, NisabBasis basis, String currency,
                                   BigDecimal thresholdValue, WealthSnapshot wealthAtStart, String userNotes) {
        try {
            if (!hawlCalendar.isSupported(hawlStart)) {
                throw new InvalidTransitionException(String.format(
                        "Hawl start date %s is outside the supported Hijri calendar range", hawlStart));
            }

            recordRepository.findFirstByUserIdAndStatus(userId, RecordStatus.DRAFT).ifPresent(open -> {
                throw new DuplicateOpenWindowException(userId, open.getRecordId());
            });

            Instant now = clock.instant();
            LocalDate expected = hawlCalendar.expectedCompletion(hawlStart);

            NisabYearRecordEntity record = recordRepository.saveAndFlush(NisabYearRecordEntity.builder()
                    .recordId(UUID.randomUUID())
                    .userId(userId)
                    .openWindowUserId(userId)
                    .status(RecordStatus.DRAFT)
                    .hawlStartDate(hawlStart)
                    .hawlStartDateHijri(hawlCalendar.toHijri(hawlStart))
                    .hawlStartHijriYear(hawlCalendar.hijriYear(hawlStart))
                    .expectedCompletionDate(expected)
                    .expectedCompletionDateHijri(hawlCalendar.toHijri(expected))
                    .nisabBasis(basis)
                    .currency(currency.toUpperCase(Locale.ROOT))
                    .thresholdValue(thresholdValue)
                    .userNotes(userNotes)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());

            auditLedger.append(record.getRecordId(), userId, AuditEventType.CREATED,
                    RecordCreatedChange.builder()
                            .hawlStartDate(record.getHawlStartDate())
                            .hawlStartDateHijri(record.getHawlStartDateHijri())
                            .expectedCompletionDate(record.getExpectedCompletionDate())
                            .nisabBasis(basis)
                            .currency(record.getCurrency())
                            .thresholdValue(thresholdValue)
                            .wealthAtStart(wealthAtStart != null ? wealthAtStart.getTotal() : null)
                            .build(),
                    null);
            publish(AuditEventType.CREATED, record, now);

            log.info("Opened Hawl window {} for user {}: {} basis, threshold {} {}, completes {}",
                    record.getRecordId(), userId, basis, thresholdValue, record.getCurrency(), expected);
            return succeeded("create", record);

        } catch (RecordValidationException e) {
            return rejected("create", e);
        }
    }

    /**
     * Lock the record's financial values. From DRAFT the Hawl must have elapsed and
     * {@code finalWealth} supplies the wealth to lock; from UNLOCKED the current
     * (possibly edited) values are re-locked and {@code finalWealth} is ignored.
     * The obligation always uses the record's locked threshold.
     */
    @Transactional
    public LifecycleOutcome finalizeRecord(UUID userId, UUID recordId, WealthSnapshot finalWealth) {
        try {
            NisabYearRecordEntity record = loadForUpdate(userId, recordId);
            Instant now = clock.instant();
            AuditEventType eventType;

            if (record.getStatus() == RecordStatus.DRAFT) {
                LocalDate today = LocalDate.now(clock);
                if (!hawlCalendar.isComplete(record.getExpectedCompletionDate(), today)) {
                    throw new InvalidTransitionException(String.format(
                            "Hawl for record %s completes on %s and cannot be finalized yet",
                            recordId, record.getExpectedCompletionDate()));
                }
                if (finalWealth == null) {
                    throw new InvalidTransitionException("A final wealth snapshot is required to finalize a draft");
                }
                eventType = AuditEventType.FINALIZED;
            } else if (record.getStatus() == RecordStatus.UNLOCKED) {
                eventType = AuditEventType.REFINALIZED;
            } else {
                throw new InvalidTransitionException("finalize", record.getStatus());
            }

            FinancialState before = financialState(record);

            BigDecimal wealth;
            if (eventType == AuditEventType.FINALIZED) {
                wealth = finalWealth.getTotal();
                record.setZakatableWealthEncrypted(encryptionService.encrypt(wealth.toPlainString()));
                record.setAssetBreakdownEncrypted(encryptionService.encrypt(toJson(finalWealth.getBreakdown())));
            } else {
                wealth = before.getZakatableWealth() != null ? before.getZakatableWealth() : BigDecimal.ZERO;
            }

            record.setObligationAmount(computeObligation(wealth, record.getThresholdValue()));
            record.lock(RecordStatus.FINALIZED, now);
            record = recordRepository.save(record);

            auditLedger.append(recordId, record.getUserId(), eventType,
                    RecordLockedChange.builder().before(before).after(financialState(record)).build(),
                    null);
            publish(eventType, record, now);

            log.info("Record {} {}: obligation {} {}", recordId, eventType.name().toLowerCase(Locale.ROOT),
                    record.getObligationAmount(), record.getCurrency());
            return succeeded("finalize", record);

        } catch (RecordValidationException e) {
            return rejected("finalize", e);
        }
    }

    /**
     * Reopen a finalized record for correction. Locked values are kept and the
     * justification is stored encrypted on the audit entry.
     */
    @Transactional
    public LifecycleOutcome unlock(UUID userId, UUID recordId, String reason) {
        try {
            NisabYearRecordEntity record = loadForUpdate(userId, recordId);
            if (record.getStatus() != RecordStatus.FINALIZED) {
                throw new InvalidTransitionException("unlock", record.getStatus());
            }

            String justification = reason != null ? reason.trim() : "";
            if (justification.length() < MIN_UNLOCK_REASON_LENGTH || justification.length() > MAX_UNLOCK_REASON_LENGTH) {
                throw new InsufficientJustificationException(MIN_UNLOCK_REASON_LENGTH, MAX_UNLOCK_REASON_LENGTH);
            }

            Instant now = clock.instant();
            record.unlock(now);
            record = recordRepository.save(record);

            auditLedger.append(recordId, record.getUserId(), AuditEventType.UNLOCKED,
                    StatusChange.builder().fromStatus(RecordStatus.FINALIZED).toStatus(RecordStatus.UNLOCKED).build(),
                    justification);
            publish(AuditEventType.UNLOCKED, record, now);

            log.info("Record {} unlocked by user {}", recordId, userId);
            return succeeded("unlock", record);

        } catch (RecordValidationException e) {
            return rejected("unlock", e);
        }
    }

    /**
     * Correct fields of an unlocked record. Status is unchanged. An edit that changes
     * nothing writes nothing.
     */
    @Transactional
    public LifecycleOutcome edit(UUID userId, UUID recordId, RecordEdit edit) {
        try {
            NisabYearRecordEntity record = loadForUpdate(userId, recordId);
            if (record.getStatus() != RecordStatus.UNLOCKED) {
                throw new InvalidTransitionException("edit", record.getStatus());
            }

            List<FieldChange> changes = new ArrayList<>();

            if (edit.getThresholdValue() != null && differs(record.getThresholdValue(), edit.getThresholdValue())) {
                changes.add(change("thresholdValue", record.getThresholdValue(), edit.getThresholdValue()));
                record.setThresholdValue(edit.getThresholdValue());
            }

            if (edit.getZakatableWealth() != null) {
                BigDecimal currentWealth = decryptAmount(record.getZakatableWealthEncrypted());
                if (currentWealth == null || differs(currentWealth, edit.getZakatableWealth())) {
                    changes.add(change("zakatableWealth", currentWealth, edit.getZakatableWealth()));
                    record.setZakatableWealthEncrypted(
                            encryptionService.encrypt(edit.getZakatableWealth().toPlainString()));
                }
            }

            if (edit.getUserNotes() != null && !edit.getUserNotes().equals(record.getUserNotes())) {
                changes.add(FieldChange.builder()
                        .field("userNotes")
                        .before(record.getUserNotes())
                        .after(edit.getUserNotes())
                        .build());
                record.setUserNotes(edit.getUserNotes());
            }

            if (changes.isEmpty()) {
                log.debug("Edit of record {} changed nothing", recordId);
                return succeeded("edit", record);
            }

            Instant now = clock.instant();
            record = recordRepository.save(record);

            auditLedger.append(recordId, record.getUserId(), AuditEventType.EDITED,
                    RecordEditedChange.builder().changes(changes).build(), null);
            publish(AuditEventType.EDITED, record, now);

            log.info("Record {} edited: {} field(s) changed", recordId, changes.size());
            return succeeded("edit", record);

        } catch (RecordValidationException e) {
            return rejected("edit", e);
        }
    }

    /**
     * Remove a draft. The audit trail is kept and gains a DELETED entry.
     */
    @Transactional
    public LifecycleOutcome delete(UUID userId, UUID recordId) {
        try {
            NisabYearRecordEntity record = loadForUpdate(userId, recordId);
            if (!record.isDraft()) {
                throw new InvalidTransitionException("delete", record.getStatus());
            }

            Instant now = clock.instant();
            recordRepository.delete(record);

            auditLedger.append(recordId, record.getUserId(), AuditEventType.DELETED,
                    StatusChange.builder().fromStatus(RecordStatus.DRAFT).build(), null);
            publishRemoval(AuditEventType.DELETED, record, now);

            log.info("Draft record {} deleted by user {}", recordId, userId);
            return succeeded("delete", record);

        } catch (RecordValidationException e) {
            return rejected("delete", e);
        }
    }

    /**
     * Close a draft whose wealth fell below Nisab before the Hawl completed. The
     * record is removed so the user can open a fresh window on the next crossing.
     */
    @Transactional
    public LifecycleOutcome interrupt(UUID recordId, BigDecimal currentWealth, BigDecimal currentThreshold) {
        try {
            NisabYearRecordEntity record = recordRepository.findForUpdate(recordId)
                    .orElseThrow(() -> new RecordNotFoundException(recordId));
            if (!record.isDraft()) {
                throw new InvalidTransitionException("interrupt", record.getStatus());
            }

            Instant now = clock.instant();
            LocalDate today = LocalDate.now(clock);
            recordRepository.delete(record);

            auditLedger.append(recordId, record.getUserId(), AuditEventType.INTERRUPTED,
                    WindowInterruptedChange.builder()
                            .currentWealth(currentWealth)
                            .thresholdValue(currentThreshold)
                            .interruptedOn(today)
                            .daysCompleted(hawlCalendar.daysElapsed(record.getHawlStartDate(), today))
                            .build(),
                    null);
            publishRemoval(AuditEventType.INTERRUPTED, record, now);

            log.info("Hawl window {} for user {} interrupted after {} days",
                    recordId, record.getUserId(), hawlCalendar.daysElapsed(record.getHawlStartDate(), today));
            return succeeded("interrupt", record);

        } catch (RecordValidationException e) {
            return rejected("interrupt", e);
        }
    }

    /**
     * Decrypt the locked financial fields of a record for display.
     */
    public FinancialState financialState(NisabYearRecordEntity record) {
        return FinancialState.builder()
                .status(record.getStatus())
                .nisabBasis(record.getNisabBasis())
                .thresholdValue(record.getThresholdValue())
                .zakatableWealth(decryptAmount(record.getZakatableWealthEncrypted()))
                .obligationAmount(record.getObligationAmount())
                .finalizedAt(record.getFinalizedAt())
                .build();
    }

    public Map<AssetCategory, BigDecimal> assetBreakdown(NisabYearRecordEntity record) {
        String json = encryptionService.decrypt(record.getAssetBreakdownEncrypted());
        if (json == null) {
            return null;
        }
        try {
            return new EnumMap<>(objectMapper.readValue(json, BREAKDOWN_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable asset breakdown on record " + record.getRecordId(), e);
        }
    }

    private NisabYearRecordEntity loadForUpdate(UUID userId, UUID recordId) {
        return recordRepository.findForUpdate(recordId)
                .filter(record -> record.isOwnedBy(userId))
                .orElseThrow(() -> new RecordNotFoundException(recordId));
    }

    private BigDecimal decryptAmount(String encrypted) {
        String plaintext = encryptionService.decrypt(encrypted);
        return plaintext != null ? new BigDecimal(plaintext) : null;
    }

    private boolean differs(BigDecimal current, BigDecimal proposed) {
        return current == null || current.compareTo(proposed) != 0;
    }

    private FieldChange change(String field, BigDecimal before, BigDecimal after) {
        return FieldChange.builder()
                .field(field)
                .before(before != null ? before.toPlainString() : null)
                .after(after.toPlainString())
                .build();
    }

    private void publish(AuditEventType eventType, NisabYearRecordEntity record, Instant at) {
        writeOutbox(eventType, record, record.getStatus(), at);
    }

    private void publishRemoval(AuditEventType eventType, NisabYearRecordEntity record, Instant at) {
        writeOutbox(eventType, record, null, at);
    }

    private void writeOutbox(AuditEventType eventType, NisabYearRecordEntity record, RecordStatus status, Instant at) {
        RecordLifecycleEvent event = RecordLifecycleEvent.builder()
                .eventId(UUID.randomUUID())
                .eventType(eventType)
                .recordId(record.getRecordId())
                .userId(record.getUserId())
                .status(status)
                .hawlStartDate(record.getHawlStartDate())
                .expectedCompletionDate(record.getExpectedCompletionDate())
                .occurredAt(at)
                .build();

        outboxEventRepository.save(OutboxEventEntity.builder()
                .eventId(event.getEventId())
                .eventType("RECORD_" + eventType.name())
                .recordId(record.getRecordId())
                .userId(record.getUserId())
                .payload(toJson(event))
                .createdAt(at)
                .build());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private LifecycleOutcome succeeded(String operation, NisabYearRecordEntity record) {
        count(operation, "success");
        return LifecycleOutcome.succeeded(record);
    }

    private LifecycleOutcome rejected(String operation, RecordValidationException e) {
        log.warn("Rejected {}: {}", operation, e.getMessage());
        count(operation, "rejected");
        return LifecycleOutcome.rejected(e.getFailure(), e.getMessage());
    }

    private void count(String operation, String result) {
        Counter.builder("nisab.record.transition")
                .tag("operation", operation)
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
