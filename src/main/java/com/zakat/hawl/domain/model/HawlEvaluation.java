package com.zakat.hawl.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HawlEvaluation {

    private UUID userId;
    private HawlOutcome outcome;

    /** Open (or just closed) record, null when the user has no window. */
    private UUID recordId;

    private BigDecimal currentWealth;
    private BigDecimal thresholdValue;
    private LocalDate evaluatedOn;

    public static HawlEvaluation noChange(UUID userId, UUID recordId, BigDecimal wealth,
                                          BigDecimal threshold, LocalDate on) {
        return new HawlEvaluation(userId, HawlOutcome.NO_CHANGE, recordId, wealth, threshold, on);
    }
}
