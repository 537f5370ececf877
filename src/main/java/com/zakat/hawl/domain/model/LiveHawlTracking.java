package com.zakat.hawl.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Read-time view of an open window. Computed on demand and never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiveHawlTracking {

    private long daysElapsed;
    private long daysRemaining;
    private BigDecimal progressPercent;
    private BigDecimal currentWealth;
    private BigDecimal lockedThreshold;
    private boolean aboveThreshold;
    private boolean hawlComplete;
    private boolean canFinalize;
    private BigDecimal estimatedObligation;
    private Instant calculatedAt;
}
