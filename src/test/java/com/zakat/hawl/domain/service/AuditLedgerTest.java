package com.zakat.hawl.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zakat.hawl.domain.exception.AuditWriteFailureException;
import com.zakat.hawl.domain.model.AuditEventType;
import com.zakat.hawl.domain.model.AuditIntegrityReport;
import com.zakat.hawl.domain.model.AuditTrailEntryView;
import com.zakat.hawl.domain.model.RecordStatus;
import com.zakat.hawl.domain.model.StatusChange;
import com.zakat.hawl.infrastructure.persistence.entity.AuditTrailEntryEntity;
import com.zakat.hawl.infrastructure.persistence.repository.AuditTrailEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.zakat.hawl.domain.service.TestFixtures.NOW;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditLedgerTest {

    @Mock private AuditTrailEntryRepository auditRepository;

    private final EncryptionService encryptionService = TestFixtures.encryptionService();
    private ObjectMapper objectMapper;
    private AuditLedger auditLedger;
    private UUID recordId;
    private UUID userId;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        auditLedger = new AuditLedger(auditRepository, encryptionService, objectMapper, TestFixtures.fixedClock());
        recordId = UUID.randomUUID();
        userId = UUID.randomUUID();
    }

    @Test
    void append_firstEntry_startsSequenceAndEncrypts() {
        when(auditRepository.findFirstByRecordIdOrderBySequenceNumberDesc(recordId)).thenReturn(Optional.empty());
        when(auditRepository.saveAndFlush(any(AuditTrailEntryEntity.class))).thenAnswer(i -> i.getArgument(0));

        AuditTrailEntryEntity entry = auditLedger.append(recordId, userId, AuditEventType.UNLOCKED,
                StatusChange.builder().fromStatus(RecordStatus.FINALIZED).toStatus(RecordStatus.UNLOCKED).build(),
                "Wrong gold valuation");

        assertEquals(1L, entry.getSequenceNumber());
        assertEquals(NOW, entry.getTimestamp());
        assertNotNull(entry.getUnlockReasonEncrypted());
        assertEquals("Wrong gold valuation", encryptionService.decrypt(entry.getUnlockReasonEncrypted()));
    }

    @Test
    void append_neverMovesTimestampBackwards() {
        Instant later = NOW.plus(Duration.ofSeconds(5));
        when(auditRepository.findFirstByRecordIdOrderBySequenceNumberDesc(recordId))
                .thenReturn(Optional.of(entry(3, AuditEventType.UNLOCKED, later)));
        when(auditRepository.saveAndFlush(any(AuditTrailEntryEntity.class))).thenAnswer(i -> i.getArgument(0));

        AuditTrailEntryEntity appended = auditLedger.append(recordId, userId, AuditEventType.EDITED, null, null);

        assertEquals(4L, appended.getSequenceNumber());
        assertEquals(later, appended.getTimestamp());
        assertNull(appended.getUnlockReasonEncrypted());
    }

    @Test
    void append_storageFailure_raisesAuditWriteFailure() {
        when(auditRepository.findFirstByRecordIdOrderBySequenceNumberDesc(recordId)).thenReturn(Optional.empty());
        when(auditRepository.saveAndFlush(any(AuditTrailEntryEntity.class)))
                .thenThrow(new DataAccessResourceFailureException("connection lost"));

        AuditWriteFailureException ex = assertThrows(AuditWriteFailureException.class,
                () -> auditLedger.append(recordId, userId, AuditEventType.CREATED, null, null));
        assertEquals("AUDIT_WRITE_FAILURE", ex.getErrorCode());
    }

    @Test
    void listForRecord_decryptsChangeAndReason() throws Exception {
        AuditTrailEntryEntity unlocked = AuditTrailEntryEntity.builder()
                .entryId(UUID.randomUUID())
                .recordId(recordId)
                .userId(userId)
                .sequenceNumber(3)
                .eventType(AuditEventType.UNLOCKED)
                .timestamp(NOW)
                .changeSummaryEncrypted(encryptionService.encrypt(objectMapper.writeValueAsString(
                        StatusChange.builder().fromStatus(RecordStatus.FINALIZED).toStatus(RecordStatus.UNLOCKED).build())))
                .unlockReasonEncrypted(encryptionService.encrypt("Wrong gold valuation"))
                .build();
        when(auditRepository.findByRecordIdOrderBySequenceNumberAsc(recordId)).thenReturn(List.of(unlocked));

        List<AuditTrailEntryView> views = auditLedger.listForRecord(recordId);

        assertEquals(1, views.size());
        StatusChange change = assertInstanceOf(StatusChange.class, views.get(0).getChange());
        assertEquals(RecordStatus.UNLOCKED, change.getToStatus());
        assertEquals("Wrong gold valuation", views.get(0).getUnlockReason());
    }

    @Test
    void verify_legalHistory_isClean() {
        when(auditRepository.findByRecordIdOrderBySequenceNumberAsc(recordId)).thenReturn(List.of(
                entry(1, AuditEventType.CREATED, NOW),
                entry(2, AuditEventType.FINALIZED, NOW.plusSeconds(10)),
                entry(3, AuditEventType.UNLOCKED, NOW.plusSeconds(20)),
                entry(4, AuditEventType.EDITED, NOW.plusSeconds(30)),
                entry(5, AuditEventType.REFINALIZED, NOW.plusSeconds(40))));

        AuditIntegrityReport report = auditLedger.verify(recordId);

        assertTrue(report.isClean(), () -> "unexpected anomalies " + report.getAnomalies());
        assertEquals(5, report.getTotalEvents());
        assertEquals(1, report.getEventCounts().get(AuditEventType.REFINALIZED));
        assertEquals(NOW, report.getEarliest());
        assertEquals(NOW.plusSeconds(40), report.getLatest());
    }

    @Test
    void verify_flagsIllegalSequenceAndClockSkew() {
        when(auditRepository.findByRecordIdOrderBySequenceNumberAsc(recordId)).thenReturn(List.of(
                entry(1, AuditEventType.CREATED, NOW),
                entry(2, AuditEventType.UNLOCKED, NOW.minusSeconds(10)),
                entry(4, AuditEventType.FINALIZED, NOW.plusSeconds(10))));

        AuditIntegrityReport report = auditLedger.verify(recordId);

        assertFalse(report.isClean());
        assertTrue(report.getAnomalies().stream().anyMatch(a -> a.contains("CREATED -> UNLOCKED")));
        assertTrue(report.getAnomalies().stream().anyMatch(a -> a.contains("timestamped before")));
        assertTrue(report.getAnomalies().stream().anyMatch(a -> a.contains("Sequence gap")));
    }

    @Test
    void verify_emptyTrail() {
        when(auditRepository.findByRecordIdOrderBySequenceNumberAsc(recordId)).thenReturn(List.of());

        AuditIntegrityReport report = auditLedger.verify(recordId);

        assertEquals(0, report.getTotalEvents());
        assertTrue(report.isClean());
    }

    private AuditTrailEntryEntity entry(long sequence, AuditEventType type, Instant timestamp) {
        return AuditTrailEntryEntity.builder()
                .entryId(UUID.randomUUID())
                .recordId(recordId)
                .userId(userId)
                .sequenceNumber(sequence)
                .eventType(type)
                .timestamp(timestamp)
                .build();
    }
}
