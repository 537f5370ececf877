package com.zakat.hawl.domain.exception;

/**
 * Base exception for the Nisab and Hawl engine. Carries a stable error code for API clients.
 */
public class HawlEngineException extends RuntimeException {

    private final String errorCode;

    public HawlEngineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public HawlEngineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
