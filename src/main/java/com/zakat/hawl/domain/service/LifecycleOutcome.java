package com.zakat.hawl.domain.service;

import com.zakat.hawl.domain.model.LifecycleFailure;
import com.zakat.hawl.infrastructure.persistence.entity.NisabYearRecordEntity;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of a {@link RecordLifecycle} operation: the record as it stands after the
 * transition, or the reason the transition was rejected. For delete and interrupt
 * the record is the last state before removal.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class LifecycleOutcome {

    private final boolean success;
    private final NisabYearRecordEntity record;
    private final LifecycleFailure failure;
    private final String message;

    public static LifecycleOutcome succeeded(NisabYearRecordEntity record) {
        return new LifecycleOutcome(true, record, null, null);
    }

    public static LifecycleOutcome rejected(LifecycleFailure failure, String message) {
        return new LifecycleOutcome(false, null, failure, message);
    }

    public boolean isRejected() {
        return !success;
    }
}
