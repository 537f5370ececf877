package com.zakat.hawl.infrastructure.persistence.entity;

import com.zakat.hawl.domain.model.NisabBasis;
import com.zakat.hawl.domain.model.RecordStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One Hawl observation window for one user.
 *
 * openWindowUserId mirrors userId while the record is DRAFT and is null otherwise;
 * its unique constraint keeps at most one open window per user at database level.
 * Wealth and breakdown are stored encrypted.
 */
@Entity
@Table(name = "nisab_year_records", indexes = {
    @Index(name = "idx_records_user_status", columnList = "userId,status"),
    @Index(name = "idx_records_created_at", columnList = "createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NisabYearRecordEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID recordId;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID userId;

    @Column(unique = true, columnDefinition = "UUID")
    private UUID openWindowUserId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RecordStatus status;

    @Column(nullable = false)
    private LocalDate hawlStartDate;

    @Column(nullable = false, length = 10)
    private String hawlStartDateHijri;

    @Column(nullable = false)
    private Integer hawlStartHijriYear;

    @Column(nullable = false)
    private LocalDate expectedCompletionDate;

    @Column(nullable = false, length = 10)
    private String expectedCompletionDateHijri;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private NisabBasis nisabBasis;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal thresholdValue;

    @Column(columnDefinition = "TEXT")
    private String zakatableWealthEncrypted;

    @Column(precision = 19, scale = 4)
    private BigDecimal obligationAmount;

    @Column(columnDefinition = "TEXT")
    private String assetBreakdownEncrypted;

    @Column(length = 1000)
    private String userNotes;

    @Column
    private Instant finalizedAt;

    @Column
    private Instant unlockedAt;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (recordId == null) {
            recordId = UUID.randomUUID();
        }
        if (status == null) {
            status = RecordStatus.DRAFT;
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isDraft() {
        return status == RecordStatus.DRAFT;
    }

    public boolean isOwnedBy(UUID candidateUserId) {
        return userId.equals(candidateUserId);
    }

    /**
     * Close the open window and move to the given locked status.
     */
    public void lock(RecordStatus lockedStatus, Instant at) {
        this.status = lockedStatus;
        this.openWindowUserId = null;
        this.finalizedAt = at;
    }

    public void unlock(Instant at) {
        this.status = RecordStatus.UNLOCKED;
        this.unlockedAt = at;
    }
}
