package com.zakat.hawl.domain.exception;

import com.zakat.hawl.domain.model.MetalType;

public class PriceUnavailableException extends HawlEngineException {

    public PriceUnavailableException(MetalType metal, String currency, Throwable cause) {
        super("PRICE_UNAVAILABLE",
                String.format("No fresh or cached %s price available in %s", metal, currency), cause);
    }
}
