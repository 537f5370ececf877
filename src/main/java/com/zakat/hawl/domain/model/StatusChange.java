package com.zakat.hawl.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Status-only transition (unlock, delete). Financial values are unchanged by these events.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class StatusChange extends AuditChange {

    private RecordStatus fromStatus;

    /** Null when the record was removed. */
    private RecordStatus toStatus;
}
