package com.zakat.hawl.domain.service;

import com.zakat.hawl.domain.exception.DetectionRunInProgressException;
import com.zakat.hawl.domain.exception.PriceUnavailableException;
import com.zakat.hawl.domain.model.HawlDetectionJobResult;
import com.zakat.hawl.domain.model.HawlEvaluation;
import com.zakat.hawl.domain.model.HawlOutcome;
import com.zakat.hawl.domain.model.MetalType;
import com.zakat.hawl.domain.model.NisabBasis;
import com.zakat.hawl.domain.model.UserProfile;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static com.zakat.hawl.domain.service.TestFixtures.TODAY;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PeriodicDetectionJobTest {

    @Mock private UserDirectory userDirectory;
    @Mock private HawlTracker hawlTracker;

    private MeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
    }

    @Test
    void runOnce_isolatesPerUserFailures() {
        UserProfile crossing = user();
        UserProfile failing = user();
        UserProfile completed = user();
        UserProfile interrupted = user();
        UserProfile unchanged = user();
        when(userDirectory.findUsersToEvaluate()).thenReturn(List.of(crossing, failing, completed, interrupted, unchanged));

        when(hawlTracker.evaluate(crossing)).thenReturn(evaluation(crossing, HawlOutcome.THRESHOLD_FIRST_CROSSED));
        when(hawlTracker.evaluate(failing)).thenThrow(new PriceUnavailableException(MetalType.GOLD, "USD", null));
        when(hawlTracker.evaluate(completed)).thenReturn(evaluation(completed, HawlOutcome.WINDOW_COMPLETED));
        when(hawlTracker.evaluate(interrupted)).thenReturn(evaluation(interrupted, HawlOutcome.WINDOW_INTERRUPTED));
        when(hawlTracker.evaluate(unchanged)).thenReturn(evaluation(unchanged, HawlOutcome.NO_CHANGE));

        HawlDetectionJobResult result = job(new SyncTaskExecutor(), Duration.ofSeconds(30)).runOnce();

        assertEquals(5, result.getUsersScheduled());
        assertEquals(4, result.getUsersProcessed());
        assertEquals(1, result.getFailures());
        assertEquals(1, result.getThresholdCrossings());
        assertEquals(1, result.getWindowCompletions());
        assertEquals(1, result.getWindowInterruptions());
        assertEquals(0, result.getAbandoned());
        assertEquals(1, result.getErrors().size());
        assertTrue(result.getErrors().get(0).startsWith(failing.getUserId().toString()));
        verify(hawlTracker).evaluate(unchanged);

        assertEquals(1.0, meterRegistry.get("hawl.detection.users").tag("result", "failed").counter().count());
        assertEquals(4.0, meterRegistry.get("hawl.detection.users").tag("result", "processed").counter().count());
    }

    @Test
    void runOnce_deadlineAbandonsUnfinishedUsers() {
        when(userDirectory.findUsersToEvaluate()).thenReturn(List.of(user(), user()));
        TaskExecutor stalledExecutor = task -> {
        };

        HawlDetectionJobResult result = job(stalledExecutor, Duration.ofMillis(20)).runOnce();

        assertEquals(2, result.getAbandoned());
        assertEquals(0, result.getUsersProcessed());
        verifyNoInteractions(hawlTracker);
    }

    @Test
    void runOnce_refusesOverlappingRun() {
        UserProfile user = user();
        PeriodicDetectionJob job = job(new SyncTaskExecutor(), Duration.ofSeconds(30));
        when(userDirectory.findUsersToEvaluate()).thenReturn(List.of(user));
        when(hawlTracker.evaluate(user)).thenAnswer(invocation -> {
            assertThrows(DetectionRunInProgressException.class, job::runOnce);
            return evaluation(user, HawlOutcome.NO_CHANGE);
        });

        HawlDetectionJobResult result = job.runOnce();

        assertEquals(1, result.getUsersProcessed());
        assertEquals(0, result.getFailures());
    }

    @Test
    void lastResult_isRetained() {
        when(userDirectory.findUsersToEvaluate()).thenReturn(List.of());
        PeriodicDetectionJob job = job(new SyncTaskExecutor(), Duration.ofSeconds(30));

        assertTrue(job.getLastResult().isEmpty());
        HawlDetectionJobResult result = job.runOnce();

        assertSame(result, job.getLastResult().orElseThrow());
        assertEquals(0, result.getUsersScheduled());
    }

    @Test
    void disabledJob_doesNotStart() {
        PeriodicDetectionJob job = new PeriodicDetectionJob(userDirectory, hawlTracker, new SyncTaskExecutor(),
                meterRegistry, TestFixtures.fixedClock(), false,
                Duration.ofHours(1), Duration.ofMinutes(1), Duration.ofSeconds(30));

        job.start();

        assertFalse(job.isRunning());
        job.stop();
    }

    @Test
    void enabledJob_startsAndStops() {
        PeriodicDetectionJob job = new PeriodicDetectionJob(userDirectory, hawlTracker, new SyncTaskExecutor(),
                meterRegistry, TestFixtures.fixedClock(), true,
                Duration.ofHours(1), Duration.ofHours(1), Duration.ofSeconds(30));

        job.start();
        assertTrue(job.isRunning());

        job.stop();
        assertFalse(job.isRunning());
        verifyNoInteractions(userDirectory);
    }

    @Test
    void enabledJob_firstRunFollowsInjectedClock() {
        PeriodicDetectionJob job = new PeriodicDetectionJob(userDirectory, hawlTracker, new SyncTaskExecutor(),
                meterRegistry, TestFixtures.fixedClock(), true,
                Duration.ofHours(1), Duration.ZERO, Duration.ofSeconds(30));

        job.start();
        try {
            verify(userDirectory, timeout(5000)).findUsersToEvaluate();
        } finally {
            job.stop();
        }
    }

    private PeriodicDetectionJob job(TaskExecutor executor, Duration deadline) {
        return new PeriodicDetectionJob(userDirectory, hawlTracker, executor, meterRegistry,
                TestFixtures.fixedClock(), true, Duration.ofHours(1), Duration.ofMinutes(1), deadline);
    }

    private UserProfile user() {
        return UserProfile.builder()
                .userId(UUID.randomUUID())
                .currency("USD")
                .nisabBasis(NisabBasis.GOLD)
                .build();
    }

    private HawlEvaluation evaluation(UserProfile user, HawlOutcome outcome) {
        return HawlEvaluation.builder()
                .userId(user.getUserId())
                .outcome(outcome)
                .evaluatedOn(TODAY)
                .build();
    }
}
