package com.zakat.hawl.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditTrailEntryView {

    private UUID entryId;
    private UUID recordId;
    private long sequenceNumber;
    private AuditEventType eventType;
    private Instant timestamp;
    private AuditChange change;

    /** Decrypted justification, present on UNLOCKED entries only. */
    private String unlockReason;
}
