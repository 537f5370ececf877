package com.zakat.hawl.domain.exception;

import com.zakat.hawl.domain.model.LifecycleFailure;

public class InsufficientJustificationException extends RecordValidationException {

    public InsufficientJustificationException(int minLength, int maxLength) {
        super("INSUFFICIENT_JUSTIFICATION",
                String.format("Unlock reason must be between %d and %d characters", minLength, maxLength));
    }

    @Override
    public LifecycleFailure getFailure() {
        return LifecycleFailure.INSUFFICIENT_JUSTIFICATION;
    }
}
