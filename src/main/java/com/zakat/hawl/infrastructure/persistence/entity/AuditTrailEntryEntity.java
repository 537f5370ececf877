package com.zakat.hawl.infrastructure.persistence.entity;

import com.zakat.hawl.domain.model.AuditEventType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable audit fact about a Nisab year record.
 *
 * Holds the record id only, never a reference to the record entity, so the trail
 * outlives a removed draft. Hibernate never issues UPDATE for this entity and the
 * lifecycle callbacks below refuse any attempt to change or remove a row.
 */
@Entity
@Immutable
@Table(name = "audit_trail_entries",
    uniqueConstraints = @UniqueConstraint(name = "uq_audit_record_sequence", columnNames = {"recordId", "sequenceNumber"}),
    indexes = {
        @Index(name = "idx_audit_record_seq", columnList = "recordId,sequenceNumber"),
        @Index(name = "idx_audit_user_timestamp", columnList = "userId,timestamp")
    })
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class AuditTrailEntryEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID entryId;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID recordId;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID userId;

    @Column(nullable = false)
    private long sequenceNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AuditEventType eventType;

    @Column(nullable = false)
    private Instant timestamp;

    @Column(columnDefinition = "TEXT")
    private String changeSummaryEncrypted;

    @Column(columnDefinition = "TEXT")
    private String unlockReasonEncrypted;

    @PrePersist
    protected void onCreate() {
        if (entryId == null) {
            entryId = UUID.randomUUID();
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    @PreUpdate
    @PreRemove
    protected void rejectMutation() {
        throw new IllegalStateException("Audit trail entries are append-only: " + entryId);
    }
}
