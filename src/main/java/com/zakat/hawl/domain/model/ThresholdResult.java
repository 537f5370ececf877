package com.zakat.hawl.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Nisab threshold in a reporting currency, with the price reading it was derived from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThresholdResult {

    private NisabBasis basis;
    private String currency;
    private BigDecimal pricePerGram;
    private BigDecimal thresholdValue;
    private Instant priceFetchedAt;
    private PriceSource source;
}
