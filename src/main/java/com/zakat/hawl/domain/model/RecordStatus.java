package com.zakat.hawl.domain.model;

public enum RecordStatus {
    DRAFT,
    FINALIZED,
    UNLOCKED
}
