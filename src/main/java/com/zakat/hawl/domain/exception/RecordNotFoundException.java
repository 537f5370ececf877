package com.zakat.hawl.domain.exception;

import com.zakat.hawl.domain.model.LifecycleFailure;

import java.util.UUID;

/**
 * Raised for missing records and for records owned by another user, so that
 * callers cannot probe for other users' record ids.
 */
public class RecordNotFoundException extends RecordValidationException {

    public RecordNotFoundException(UUID recordId) {
        super("RECORD_NOT_FOUND", "Record not found: " + recordId);
    }

    @Override
    public LifecycleFailure getFailure() {
        return LifecycleFailure.RECORD_NOT_FOUND;
    }
}
