package com.zakat.hawl.domain.service;

import com.zakat.hawl.domain.exception.DetectionRunInProgressException;
import com.zakat.hawl.domain.model.HawlDetectionJobResult;
import com.zakat.hawl.domain.model.HawlEvaluation;
import com.zakat.hawl.domain.model.UserProfile;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives {@link HawlTracker} over the whole user population on a fixed interval.
 *
 * Owns its scheduler and starts and stops with the application context. Each user is
 * one task on a bounded executor; a failing user is logged and counted without
 * affecting the others. A run waits at most the configured deadline; users still in
 * flight after that are reported as abandoned and picked up by the next run.
 * Overlapping runs are refused.
 *
 * {@link #runOnce()} is the manual trigger and behaves exactly like a scheduled run.
 */
@Slf4j
@Component
public class PeriodicDetectionJob implements SmartLifecycle {

    private static final int MAX_REPORTED_ERRORS = 50;

    private final UserDirectory userDirectory;
    private final HawlTracker hawlTracker;
    private final TaskExecutor executor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final boolean enabled;
    private final Duration interval;
    private final Duration initialDelay;
    private final Duration deadline;

    private final AtomicBoolean inProgress = new AtomicBoolean(false);
    private final AtomicReference<HawlDetectionJobResult> lastResult = new AtomicReference<>();

    private volatile ThreadPoolTaskScheduler scheduler;
    private volatile ScheduledFuture<?> scheduledRun;

    public PeriodicDetectionJob(UserDirectory userDirectory,
                                HawlTracker hawlTracker,
                                @Qualifier("hawlDetectionExecutor") TaskExecutor executor,
                                MeterRegistry meterRegistry,
                                Clock clock,
                                @Value("${app.hawl.detection.enabled:true}") boolean enabled,
                                @Value("${app.hawl.detection.interval:PT1H}") Duration interval,
                                @Value("${app.hawl.detection.initial-delay:PT1M}") Duration initialDelay,
                                @Value("${app.hawl.detection.deadline:PT30S}") Duration deadline) {
        this.userDirectory = userDirectory;
        this.hawlTracker = hawlTracker;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.enabled = enabled;
        this.interval = interval;
        this.initialDelay = initialDelay;
        this.deadline = deadline;
    }

    @Override
    public void start() {
        if (!enabled) {
            log.info("Hawl detection job disabled");
            return;
        }

        ThreadPoolTaskScheduler taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.setThreadNamePrefix("hawl-detection-scheduler-");
        taskScheduler.setClock(clock);
        taskScheduler.initialize();

        scheduler = taskScheduler;
        scheduledRun = taskScheduler.scheduleAtFixedRate(this::runScheduled,
                clock.instant().plus(initialDelay), interval);

        log.info("Hawl detection job started: every {} after {}, deadline {}", interval, initialDelay, deadline);
    }

    @Override
    public void stop() {
        ScheduledFuture<?> run = scheduledRun;
        if (run != null) {
            run.cancel(false);
            scheduledRun = null;
        }
        ThreadPoolTaskScheduler taskScheduler = scheduler;
        if (taskScheduler != null) {
            taskScheduler.shutdown();
            scheduler = null;
            log.info("Hawl detection job stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return scheduler != null;
    }

    public Optional<HawlDetectionJobResult> getLastResult() {
        return Optional.ofNullable(lastResult.get());
    }

    /**
     * Evaluate every user now.
     *
     * @throws DetectionRunInProgressException if a run is already executing
     */
    public HawlDetectionJobResult runOnce() {
        if (!inProgress.compareAndSet(false, true)) {
            throw new DetectionRunInProgressException();
        }
        try {
            HawlDetectionJobResult result = execute();
            lastResult.set(result);
            return result;
        } finally {
            inProgress.set(false);
        }
    }

    private void runScheduled() {
        try {
            runOnce();
        } catch (DetectionRunInProgressException e) {
            log.warn("Skipping scheduled Hawl detection: previous run still in progress");
        } catch (RuntimeException e) {
            log.error("Hawl detection run failed: {}", e.getMessage(), e);
        }
    }

    private HawlDetectionJobResult execute() {
        Timer.Sample sample = Timer.start(meterRegistry);
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();

        List<UserProfile> users = userDirectory.findUsersToEvaluate();
        log.info("Hawl detection run started for {} users", users.size());

        Map<UserProfile, CompletableFuture<UserRun>> runs = new LinkedHashMap<>();
        for (UserProfile user : users) {
            runs.put(user, CompletableFuture.supplyAsync(() -> evaluate(user), executor));
        }

        awaitAll(runs, startNanos + deadline.toNanos());

        HawlDetectionJobResult result = HawlDetectionJobResult.builder()
                .startedAt(startedAt)
                .usersScheduled(users.size())
                .errors(new ArrayList<>())
                .build();

        for (Map.Entry<UserProfile, CompletableFuture<UserRun>> entry : runs.entrySet()) {
            CompletableFuture<UserRun> future = entry.getValue();
            if (!future.isDone()) {
                // Leaves the task to finish on its worker; the next run re-evaluates the user
                future.cancel(false);
                result.setAbandoned(result.getAbandoned() + 1);
                continue;
            }
            tally(result, entry.getKey(), future.join());
        }

        result.setFinishedAt(clock.instant());
        result.setDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));

        sample.stop(Timer.builder("hawl.detection.run.duration").register(meterRegistry));
        countUsers("processed", result.getUsersProcessed());
        countUsers("failed", result.getFailures());
        countUsers("abandoned", result.getAbandoned());

        if (result.getAbandoned() > 0) {
            log.warn("Hawl detection deadline of {} reached with {} users still in flight", deadline, result.getAbandoned());
        }
        log.info("Hawl detection run finished in {} ms: processed={}, crossings={}, completions={}, "
                        + "interruptions={}, failures={}, abandoned={}",
                result.getDurationMs(), result.getUsersProcessed(), result.getThresholdCrossings(),
                result.getWindowCompletions(), result.getWindowInterruptions(),
                result.getFailures(), result.getAbandoned());

        return result;
    }

    private UserRun evaluate(UserProfile user) {
        try {
            return UserRun.of(hawlTracker.evaluate(user));
        } catch (RuntimeException e) {
            log.error("Hawl evaluation failed for user {}: {}", user.getUserId(), e.getMessage(), e);
            return UserRun.failed(e);
        }
    }

    private void awaitAll(Map<UserProfile, CompletableFuture<UserRun>> runs, long deadlineNanos) {
        CompletableFuture<Void> all = CompletableFuture.allOf(runs.values().toArray(new CompletableFuture[0]));
        long remaining = Math.max(0, deadlineNanos - System.nanoTime());
        try {
            all.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.debug("Hawl detection deadline reached before all users finished");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Hawl detection run interrupted while waiting for users");
        } catch (ExecutionException e) {
            // Per-user tasks capture their own failures, so this only signals an executor fault
            log.error("Hawl detection worker failed: {}", e.getMessage(), e);
        }
    }

    private void tally(HawlDetectionJobResult result, UserProfile user, UserRun run) {
        if (run.error != null) {
            result.setFailures(result.getFailures() + 1);
            if (result.getErrors().size() < MAX_REPORTED_ERRORS) {
                result.getErrors().add(user.getUserId() + ": " + run.error.getMessage());
            }
            return;
        }

        result.setUsersProcessed(result.getUsersProcessed() + 1);
        switch (run.evaluation.getOutcome()) {
            case THRESHOLD_FIRST_CROSSED:
                result.setThresholdCrossings(result.getThresholdCrossings() + 1);
                break;
            case WINDOW_COMPLETED:
                result.setWindowCompletions(result.getWindowCompletions() + 1);
                break;
            case WINDOW_INTERRUPTED:
                result.setWindowInterruptions(result.getWindowInterruptions() + 1);
                break;
            default:
                break;
        }
    }

    private void countUsers(String outcome, int count) {
        if (count > 0) {
            Counter.builder("hawl.detection.users")
                    .tag("result", outcome)
                    .register(meterRegistry)
                    .increment(count);
        }
    }

    private static final class UserRun {

        private final HawlEvaluation evaluation;
        private final RuntimeException error;

        private UserRun(HawlEvaluation evaluation, RuntimeException error) {
            this.evaluation = evaluation;
            this.error = error;
        }

        static UserRun of(HawlEvaluation evaluation) {
            return new UserRun(evaluation, null);
        }

        static UserRun failed(RuntimeException error) {
            return new UserRun(null, error);
        }
    }
}
