package com.zakat.hawl.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Outbox payload published for every record transition. Carries no financial values.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordLifecycleEvent {

    private UUID eventId;
    private AuditEventType eventType;
    private UUID recordId;
    private UUID userId;

    /** Status after the transition, null when the record was removed. */
    private RecordStatus status;

    private LocalDate hawlStartDate;
    private LocalDate expectedCompletionDate;
    private Instant occurredAt;
}
