package com.zakat.hawl.domain.exception;

import com.zakat.hawl.domain.model.LifecycleFailure;

/**
 * A rejected record operation. Always raised before any state is written, and
 * converted to a typed failure at the record lifecycle boundary.
 */
public abstract class RecordValidationException extends HawlEngineException {

    protected RecordValidationException(String errorCode, String message) {
        super(errorCode, message);
    }

    public abstract LifecycleFailure getFailure();
}
