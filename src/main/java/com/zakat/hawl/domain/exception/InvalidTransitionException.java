package com.zakat.hawl.domain.exception;

import com.zakat.hawl.domain.model.LifecycleFailure;
import com.zakat.hawl.domain.model.RecordStatus;

public class InvalidTransitionException extends RecordValidationException {

    public InvalidTransitionException(String operation, RecordStatus currentStatus) {
        super("INVALID_TRANSITION",
                String.format("Cannot %s a record in %s status", operation, currentStatus));
    }

    public InvalidTransitionException(String message) {
        super("INVALID_TRANSITION", message);
    }

    @Override
    public LifecycleFailure getFailure() {
        return LifecycleFailure.INVALID_TRANSITION;
    }
}
