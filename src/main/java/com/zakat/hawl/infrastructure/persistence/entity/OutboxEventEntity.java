package com.zakat.hawl.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Record lifecycle event awaiting relay to Kafka.
 *
 * Written in the same transaction as the record transition it describes, so a
 * rolled-back transition never produces an event and a committed one always does.
 */
@Entity
@Table(name = "outbox_events", indexes = {
    @Index(name = "idx_outbox_status_created", columnList = "status,createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxEventEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID eventId;

    @Column(nullable = false, length = 50)
    private String eventType;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID recordId;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID userId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private EventStatus status = EventStatus.PENDING;

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant publishedAt;

    @Column(nullable = false)
    @Builder.Default
    private Integer attempts = 0;

    @Column(length = 500)
    private String lastError;

    public enum EventStatus {
        PENDING,
        PUBLISHED,
        FAILED
    }

    @PrePersist
    protected void onCreate() {
        if (eventId == null) {
            eventId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public void markPublished(Instant at) {
        this.status = EventStatus.PUBLISHED;
        this.publishedAt = at;
    }

    /**
     * Record a failed relay attempt. The event stays PENDING until maxAttempts is reached.
     */
    public void recordFailure(String error, int maxAttempts) {
        this.attempts = attempts + 1;
        this.lastError = error != null && error.length() > 500 ? error.substring(0, 500) : error;
        if (attempts >= maxAttempts) {
            this.status = EventStatus.FAILED;
        }
    }
}
