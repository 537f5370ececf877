package com.zakat.hawl.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Summary of one pass of the periodic detection job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HawlDetectionJobResult {

    private Instant startedAt;
    private Instant finishedAt;
    private long durationMs;

    private int usersScheduled;
    private int usersProcessed;
    private int thresholdCrossings;
    private int windowCompletions;
    private int windowInterruptions;
    private int failures;

    /** Users still in flight when the run deadline passed; picked up next interval. */
    private int abandoned;

    @Builder.Default
    private List<String> errors = new ArrayList<>();
}
