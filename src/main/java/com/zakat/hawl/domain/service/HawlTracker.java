package com.zakat.hawl.domain.service;

import com.zakat.hawl.domain.model.HawlEvaluation;
import com.zakat.hawl.domain.model.HawlOutcome;
import com.zakat.hawl.domain.model.LiveHawlTracking;
import com.zakat.hawl.domain.model.RecordStatus;
import com.zakat.hawl.domain.model.ThresholdResult;
import com.zakat.hawl.domain.model.UserProfile;
import com.zakat.hawl.domain.model.WealthSnapshot;
import com.zakat.hawl.infrastructure.persistence.entity.NisabYearRecordEntity;
import com.zakat.hawl.infrastructure.persistence.repository.NisabYearRecordRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-user Hawl state machine.
 *
 * Unarmed (no draft): wealth at or above the current threshold opens a draft.
 * Armed (draft exists): before the expected completion date a drop below the current
 * threshold interrupts the window; from that date on, wealth at or above it reports
 * the window as completed. Completion never finalizes the record; the user does.
 *
 * Evaluation holds no state of its own, so re-running it against unchanged wealth
 * and prices yields the same outcome without writing anything.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HawlTracker {

    private final NisabYearRecordRepository recordRepository;
    private final PriceOracleCache priceOracleCache;
    private final WealthAggregator wealthAggregator;
    private final RecordLifecycle recordLifecycle;
    private final UserDirectory userDirectory;
    private final HawlCalendar hawlCalendar;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public HawlEvaluation evaluate(UUID userId) {
        return evaluate(userDirectory.profileOf(userId));
    }

    public HawlEvaluation evaluate(UserProfile profile) {
        LocalDate today = LocalDate.now(clock);
        Optional<NisabYearRecordEntity> openWindow =
                recordRepository.findFirstByUserIdAndStatus(profile.getUserId(), RecordStatus.DRAFT);

        HawlEvaluation evaluation = openWindow
                .map(record -> evaluateArmed(record, today))
                .orElseGet(() -> evaluateUnarmed(profile, today));

        Counter.builder("hawl.evaluation")
                .tag("outcome", evaluation.getOutcome().name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();

        if (evaluation.getOutcome() != HawlOutcome.NO_CHANGE) {
            log.info("Hawl evaluation for user {}: {} (record {})",
                    profile.getUserId(), evaluation.getOutcome(), evaluation.getRecordId());
        }
        return evaluation;
    }

    private HawlEvaluation evaluateUnarmed(UserProfile profile, LocalDate today) {
        UUID userId = profile.getUserId();
        ThresholdResult threshold = priceOracleCache.getNisabThreshold(profile.getCurrency(), profile.getNisabBasis());
        WealthSnapshot wealth = wealthAggregator.aggregateZakatableWealth(userId);

        if (wealth.getTotal().signum() <= 0 || !wealth.meets(threshold.getThresholdValue())) {
            return HawlEvaluation.noChange(userId, null, wealth.getTotal(), threshold.getThresholdValue(), today);
        }

        LifecycleOutcome created = recordLifecycle.create(userId, today, profile.getNisabBasis(),
                threshold.getCurrency(), threshold.getThresholdValue(), wealth, null);

        if (created.isRejected()) {
            // Another caller opened a window first
            log.debug("Window not opened for user {}: {}", userId, created.getMessage());
            return HawlEvaluation.noChange(userId, null, wealth.getTotal(), threshold.getThresholdValue(), today);
        }

        return HawlEvaluation.builder()
                .userId(userId)
                .outcome(HawlOutcome.THRESHOLD_FIRST_CROSSED)
                .recordId(created.getRecord().getRecordId())
                .currentWealth(wealth.getTotal())
                .thresholdValue(threshold.getThresholdValue())
                .evaluatedOn(today)
                .build();
    }

    private HawlEvaluation evaluateArmed(NisabYearRecordEntity record, LocalDate today) {
        UUID userId = record.getUserId();
        ThresholdResult threshold = priceOracleCache.getNisabThreshold(record.getCurrency(), record.getNisabBasis());
        WealthSnapshot wealth = wealthAggregator.aggregateZakatableWealth(userId);
        boolean meets = wealth.meets(threshold.getThresholdValue());

        HawlOutcome outcome = HawlOutcome.NO_CHANGE;

        if (!hawlCalendar.isComplete(record.getExpectedCompletionDate(), today)) {
            if (!meets) {
                LifecycleOutcome interrupted = recordLifecycle.interrupt(
                        record.getRecordId(), wealth.getTotal(), threshold.getThresholdValue());
                if (interrupted.isSuccess()) {
                    outcome = HawlOutcome.WINDOW_INTERRUPTED;
                } else {
                    // Finalized or deleted by the user since it was read
                    log.debug("Interruption of record {} skipped: {}", record.getRecordId(), interrupted.getMessage());
                }
            }
        } else if (meets) {
            outcome = HawlOutcome.WINDOW_COMPLETED;
        }

        return HawlEvaluation.builder()
                .userId(userId)
                .outcome(outcome)
                .recordId(record.getRecordId())
                .currentWealth(wealth.getTotal())
                .thresholdValue(threshold.getThresholdValue())
                .evaluatedOn(today)
                .build();
    }

    /**
     * Read-time progress of an open window against its locked threshold. Writes nothing.
     */
    public LiveHawlTracking liveTracking(NisabYearRecordEntity record) {
        LocalDate today = LocalDate.now(clock);
        WealthSnapshot wealth = wealthAggregator.aggregateZakatableWealth(record.getUserId());
        boolean above = wealth.meets(record.getThresholdValue());
        boolean complete = hawlCalendar.isComplete(record.getExpectedCompletionDate(), today);

        return LiveHawlTracking.builder()
                .daysElapsed(hawlCalendar.daysElapsed(record.getHawlStartDate(), today))
                .daysRemaining(hawlCalendar.daysRemaining(record.getExpectedCompletionDate(), today))
                .progressPercent(hawlCalendar.progressPercent(record.getHawlStartDate(), today))
                .currentWealth(wealth.getTotal())
                .lockedThreshold(record.getThresholdValue())
                .aboveThreshold(above)
                .hawlComplete(complete)
                .canFinalize(complete && above)
                .estimatedObligation(RecordLifecycle.computeObligation(wealth.getTotal(), record.getThresholdValue()))
                .calculatedAt(clock.instant())
                .build();
    }
}
