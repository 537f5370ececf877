package com.zakat.hawl.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Before/after summary attached to an audit entry.
 *
 * Closed set of shapes, one per kind of event. Serialized with a {@code kind}
 * discriminator and encrypted at rest.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RecordCreatedChange.class, name = "created"),
        @JsonSubTypes.Type(value = RecordLockedChange.class, name = "locked"),
        @JsonSubTypes.Type(value = StatusChange.class, name = "status"),
        @JsonSubTypes.Type(value = RecordEditedChange.class, name = "edited"),
        @JsonSubTypes.Type(value = WindowInterruptedChange.class, name = "interrupted")
})
public abstract class AuditChange {
}
