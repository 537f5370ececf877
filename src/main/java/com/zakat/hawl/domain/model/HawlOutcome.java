package com.zakat.hawl.domain.model;

public enum HawlOutcome {
    NO_CHANGE,
    THRESHOLD_FIRST_CROSSED,
    WINDOW_COMPLETED,
    WINDOW_INTERRUPTED
}
