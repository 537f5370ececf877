package com.zakat.hawl.domain.service;

import com.zakat.hawl.domain.exception.RecordNotFoundException;
import com.zakat.hawl.domain.model.AssetCategory;
import com.zakat.hawl.domain.model.AuditTrail;
import com.zakat.hawl.domain.model.FinancialState;
import com.zakat.hawl.domain.model.HawlStatus;
import com.zakat.hawl.domain.model.LiveHawlTracking;
import com.zakat.hawl.domain.model.NisabBasis;
import com.zakat.hawl.domain.model.NisabYearRecordPage;
import com.zakat.hawl.domain.model.NisabYearRecordView;
import com.zakat.hawl.domain.model.RecordEdit;
import com.zakat.hawl.domain.model.RecordOperationResult;
import com.zakat.hawl.domain.model.RecordStatus;
import com.zakat.hawl.domain.model.ThresholdResult;
import com.zakat.hawl.domain.model.UserProfile;
import com.zakat.hawl.domain.model.WealthSnapshot;
import com.zakat.hawl.infrastructure.persistence.OffsetLimitRequest;
import com.zakat.hawl.infrastructure.persistence.entity.NisabYearRecordEntity;
import com.zakat.hawl.infrastructure.persistence.repository.NisabYearRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Caller-facing operations on Nisab year records.
 *
 * Every operation is scoped to the calling user; records owned by anyone else are
 * reported as not found. Commands go through {@link RecordLifecycle}; this class
 * resolves their inputs (threshold on create, wealth snapshot on finalize) and
 * builds the decrypted views.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NisabYearRecordService {

    static final int MAX_PAGE_SIZE = 100;

    private final NisabYearRecordRepository recordRepository;
    private final RecordLifecycle recordLifecycle;
    private final AuditLedger auditLedger;
    private final HawlTracker hawlTracker;
    private final PriceOracleCache priceOracleCache;
    private final WealthAggregator wealthAggregator;
    private final UserDirectory userDirectory;
    private final Clock clock;

    @Transactional(readOnly = true)
    public NisabYearRecordPage list(UUID userId, Collection<RecordStatus> statuses, Integer hijriYear,
                                    int limit, long offset) {
        int pageSize = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        Collection<RecordStatus> statusFilter = statuses == null || statuses.isEmpty()
                ? EnumSet.allOf(RecordStatus.class)
                : statuses;

        Page<NisabYearRecordEntity> page = recordRepository.search(userId, statusFilter, hijriYear,
                new OffsetLimitRequest(Math.max(0, offset), pageSize));

        return NisabYearRecordPage.builder()
                .records(page.getContent().stream()
                        .map(record -> toView(record, false))
                        .collect(Collectors.toList()))
                .total(page.getTotalElements())
                .limit(pageSize)
                .offset(Math.max(0, offset))
                .build();
    }

    public HawlStatus status(UUID userId) {
        Optional<NisabYearRecordEntity> open = recordRepository.findFirstByUserIdAndStatus(userId, RecordStatus.DRAFT);
        if (open.isEmpty()) {
            return HawlStatus.builder().active(false).build();
        }

        NisabYearRecordEntity record = open.get();
        LiveHawlTracking tracking = hawlTracker.liveTracking(record);
        return HawlStatus.builder()
                .active(true)
                .recordId(record.getRecordId())
                .hawlStartDate(record.getHawlStartDate())
                .hawlStartDateHijri(record.getHawlStartDateHijri())
                .expectedCompletionDate(record.getExpectedCompletionDate())
                .expectedCompletionDateHijri(record.getExpectedCompletionDateHijri())
                .daysRemaining(tracking.getDaysRemaining())
                .nisabBasis(record.getNisabBasis())
                .currency(record.getCurrency())
                .thresholdValue(record.getThresholdValue())
                .liveTracking(tracking)
                .build();
    }

    /**
     * Record with its full audit trail, plus live tracking while it is a draft.
     */
    public NisabYearRecordView get(UUID userId, UUID recordId) {
        return toView(findOwned(userId, recordId), true);
    }

    /**
     * Open a window manually. Missing basis and currency default to the user's
     * profile; a missing threshold is priced from the oracle.
     */
    public RecordOperationResult create(UUID userId, LocalDate hawlStartDate, NisabBasis basis, String currency,
                                        BigDecimal thresholdValue, String userNotes) {
        UserProfile profile = userDirectory.profileOf(userId);
        NisabBasis resolvedBasis = basis != null ? basis : profile.getNisabBasis();
        String resolvedCurrency = currency != null ? currency : profile.getCurrency();

        BigDecimal resolvedThreshold = thresholdValue;
        if (resolvedThreshold == null) {
            ThresholdResult threshold = priceOracleCache.getNisabThreshold(resolvedCurrency, resolvedBasis);
            resolvedThreshold = threshold.getThresholdValue();
        }

        WealthSnapshot wealth = wealthAggregator.aggregateZakatableWealth(userId);
        LocalDate start = hawlStartDate != null ? hawlStartDate : LocalDate.now(clock);

        return toResult(recordLifecycle.create(userId, start, resolvedBasis, resolvedCurrency,
                resolvedThreshold, wealth, userNotes));
    }

    public RecordOperationResult update(UUID userId, UUID recordId, RecordEdit edit) {
        return toResult(recordLifecycle.edit(userId, recordId, edit));
    }

    public RecordOperationResult delete(UUID userId, UUID recordId) {
        LifecycleOutcome outcome = recordLifecycle.delete(userId, recordId);
        if (outcome.isRejected()) {
            return toResult(outcome);
        }
        return RecordOperationResult.builder().success(true).build();
    }

    /**
     * Finalize a record. For a draft the wealth snapshot is aggregated now; a
     * caller-confirmed figure replaces the aggregated total when given, and a
     * differing figure replaces the breakdown with an empty one.
     */
    public RecordOperationResult finalizeRecord(UUID userId, UUID recordId, BigDecimal confirmedWealth) {
        WealthSnapshot snapshot = null;

        boolean draft = recordRepository.findById(recordId)
                .filter(record -> record.isOwnedBy(userId))
                .map(NisabYearRecordEntity::isDraft)
                .orElse(false);

        if (draft) {
            snapshot = wealthAggregator.aggregateZakatableWealth(userId);
            if (confirmedWealth != null && confirmedWealth.compareTo(snapshot.getTotal()) != 0) {
                // The per-category figures no longer add up to the confirmed total
                log.info("Finalizing record {} with caller-confirmed wealth; aggregated breakdown dropped", recordId);
                snapshot.setTotal(confirmedWealth);
                snapshot.setBreakdown(new EnumMap<>(AssetCategory.class));
            }
        }

        return toResult(recordLifecycle.finalizeRecord(userId, recordId, snapshot));
    }

    public RecordOperationResult unlock(UUID userId, UUID recordId, String reason) {
        return toResult(recordLifecycle.unlock(userId, recordId, reason));
    }

    /**
     * Audit trail and integrity report. Available after a draft has been removed.
     */
    public AuditTrail auditTrail(UUID userId, UUID recordId) {
        UUID owner = recordRepository.findById(recordId)
                .map(NisabYearRecordEntity::getUserId)
                .or(() -> auditLedger.ownerOf(recordId))
                .orElseThrow(() -> new RecordNotFoundException(recordId));

        if (!owner.equals(userId)) {
            throw new RecordNotFoundException(recordId);
        }

        return AuditTrail.builder()
                .recordId(recordId)
                .entries(auditLedger.listForRecord(recordId))
                .integrity(auditLedger.verify(recordId))
                .build();
    }

    private NisabYearRecordEntity findOwned(UUID userId, UUID recordId) {
        return recordRepository.findById(recordId)
                .filter(record -> record.isOwnedBy(userId))
                .orElseThrow(() -> new RecordNotFoundException(recordId));
    }

    private RecordOperationResult toResult(LifecycleOutcome outcome) {
        if (outcome.isRejected()) {
            return RecordOperationResult.builder()
                    .success(false)
                    .failure(outcome.getFailure())
                    .message(outcome.getMessage())
                    .build();
        }
        return RecordOperationResult.builder()
                .success(true)
                .record(toView(outcome.getRecord(), true))
                .build();
    }

    private NisabYearRecordView toView(NisabYearRecordEntity record, boolean detailed) {
        FinancialState financials = recordLifecycle.financialState(record);

        NisabYearRecordView view = NisabYearRecordView.builder()
                .recordId(record.getRecordId())
                .userId(record.getUserId())
                .status(record.getStatus())
                .hawlStartDate(record.getHawlStartDate())
                .hawlStartDateHijri(record.getHawlStartDateHijri())
                .expectedCompletionDate(record.getExpectedCompletionDate())
                .expectedCompletionDateHijri(record.getExpectedCompletionDateHijri())
                .finalizedAt(record.getFinalizedAt())
                .unlockedAt(record.getUnlockedAt())
                .nisabBasis(record.getNisabBasis())
                .currency(record.getCurrency())
                .thresholdValue(record.getThresholdValue())
                .zakatableWealth(financials.getZakatableWealth())
                .obligationAmount(record.getObligationAmount())
                .assetBreakdown(recordLifecycle.assetBreakdown(record))
                .userNotes(record.getUserNotes())
                .pendingRefinalization(record.getStatus() == RecordStatus.UNLOCKED)
                .createdAt(record.getCreatedAt())
                .updatedAt(record.getUpdatedAt())
                .build();

        if (detailed) {
            view.setAuditTrail(auditLedger.listForRecord(record.getRecordId()));
            if (record.isDraft()) {
                view.setLiveTracking(hawlTracker.liveTracking(record));
            }
        }
        return view;
    }
}
