package com.zakat.hawl.domain.model;

public enum LifecycleFailure {
    INVALID_TRANSITION,
    DUPLICATE_OPEN_WINDOW,
    INSUFFICIENT_JUSTIFICATION,
    RECORD_NOT_FOUND
}
