package com.zakat.hawl.domain.service;

import com.zakat.hawl.domain.exception.PriceFeedException;
import com.zakat.hawl.domain.model.MetalType;

import java.math.BigDecimal;

/**
 * External spot price source. Treated as untrusted and unreliable.
 */
public interface PriceFeed {

    /**
     * Current price of one gram of the metal in the given currency.
     *
     * @throws PriceFeedException on transport failure, timeout, non-2xx status or malformed payload
     */
    BigDecimal fetchPricePerGram(MetalType metal, String currency);

    String sourceName();
}
