package com.zakat.hawl.domain.exception;

import java.util.UUID;

/**
 * The ledger could not append an entry. The surrounding transition is rolled back.
 */
public class AuditWriteFailureException extends HawlEngineException {

    public AuditWriteFailureException(UUID recordId, Throwable cause) {
        super("AUDIT_WRITE_FAILURE", "Failed to append audit entry for record " + recordId, cause);
    }
}
