package com.zakat.hawl.domain.exception;

import com.zakat.hawl.domain.model.LifecycleFailure;

import java.util.UUID;

public class DuplicateOpenWindowException extends RecordValidationException {

    public DuplicateOpenWindowException(UUID userId, UUID openRecordId) {
        super("DUPLICATE_OPEN_WINDOW",
                String.format("User %s already has an open draft record %s", userId, openRecordId));
    }

    @Override
    public LifecycleFailure getFailure() {
        return LifecycleFailure.DUPLICATE_OPEN_WINDOW;
    }
}
