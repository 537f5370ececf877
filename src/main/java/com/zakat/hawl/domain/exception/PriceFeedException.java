package com.zakat.hawl.domain.exception;

/**
 * The external price feed failed: transport error, timeout, non-2xx or malformed payload.
 */
public class PriceFeedException extends HawlEngineException {

    public PriceFeedException(String message) {
        super("PRICE_FEED_ERROR", message);
    }

    public PriceFeedException(String message, Throwable cause) {
        super("PRICE_FEED_ERROR", message, cause);
    }
}
