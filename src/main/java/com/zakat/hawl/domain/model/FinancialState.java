package com.zakat.hawl.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * The lockable financial fields of a record, as captured on one side of a transition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinancialState {

    private RecordStatus status;
    private NisabBasis nisabBasis;
    private BigDecimal thresholdValue;
    private BigDecimal zakatableWealth;
    private BigDecimal obligationAmount;
    private Instant finalizedAt;
}
