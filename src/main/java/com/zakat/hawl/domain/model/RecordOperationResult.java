package com.zakat.hawl.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a record command as seen by API callers: the updated record view, or
 * the rejection reason.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordOperationResult {

    private boolean success;
    private NisabYearRecordView record;
    private LifecycleFailure failure;
    private String message;
}
