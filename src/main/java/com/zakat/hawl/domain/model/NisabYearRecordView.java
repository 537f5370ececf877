package com.zakat.hawl.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Owner-facing view of a Nisab year record with financial fields decrypted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NisabYearRecordView {

    private UUID recordId;
    private UUID userId;
    private RecordStatus status;

    private LocalDate hawlStartDate;
    private String hawlStartDateHijri;
    private LocalDate expectedCompletionDate;
    private String expectedCompletionDateHijri;
    private Instant finalizedAt;
    private Instant unlockedAt;

    private NisabBasis nisabBasis;
    private String currency;
    private BigDecimal thresholdValue;
    private BigDecimal zakatableWealth;
    private BigDecimal obligationAmount;
    private Map<AssetCategory, BigDecimal> assetBreakdown;
    private String userNotes;

    /** True while unlocked: values may be corrected and the record must be re-finalized. */
    private boolean pendingRefinalization;

    private Instant createdAt;
    private Instant updatedAt;

    private List<AuditTrailEntryView> auditTrail;
    private LiveHawlTracking liveTracking;
}
