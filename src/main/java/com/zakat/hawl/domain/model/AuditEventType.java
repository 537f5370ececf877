package com.zakat.hawl.domain.model;

/**
 * Kinds of facts the audit ledger records about a Nisab year record.
 *
 * INTERRUPTED and DELETED close out a draft window; the record row is removed
 * but its trail is kept.
 */
public enum AuditEventType {
    CREATED,
    FINALIZED,
    UNLOCKED,
    EDITED,
    REFINALIZED,
    INTERRUPTED,
    DELETED
}
