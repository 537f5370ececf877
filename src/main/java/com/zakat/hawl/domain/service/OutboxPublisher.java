package com.zakat.hawl.domain.service;

import com.zakat.hawl.infrastructure.persistence.entity.OutboxEventEntity;
import com.zakat.hawl.infrastructure.persistence.repository.OutboxEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Relays record lifecycle events from the outbox table to Kafka.
 *
 * Events are keyed by user id so one user's events stay ordered on a partition.
 * A failed send leaves the event PENDING for the next poll until the attempt limit,
 * after which it is parked as FAILED. Delivery is at-least-once.
 *
 * The poll runs outside a transaction: each event's status update commits on its own
 * through the repository, so a slow broker never holds a database transaction open
 * across a batch of sends.
 */
@Slf4j
@Service
public class OutboxPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final Clock clock;
    private final String recordEventsTopic;
    private final int batchSize;
    private final int maxAttempts;

    public OutboxPublisher(OutboxEventRepository outboxEventRepository,
                           KafkaTemplate<String, String> kafkaTemplate,
                           Clock clock,
                           @Value("${app.kafka.topics.record-events}") String recordEventsTopic,
                           @Value("${app.outbox.batch-size:10}") int batchSize,
                           @Value("${app.outbox.max-attempts:5}") int maxAttempts) {
        this.outboxEventRepository = outboxEventRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.clock = clock;
        this.recordEventsTopic = recordEventsTopic;
        this.batchSize = batchSize;
        this.maxAttempts = maxAttempts;
    }

    @Scheduled(fixedDelayString = "${app.outbox.polling-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEventEntity> pendingEvents = outboxEventRepository.findByStatusOrderByCreatedAtAsc(
                OutboxEventEntity.EventStatus.PENDING, PageRequest.of(0, batchSize));

        if (pendingEvents.isEmpty()) {
            return;
        }

        log.debug("Publishing {} pending outbox events", pendingEvents.size());

        for (OutboxEventEntity event : pendingEvents) {
            try {
                kafkaTemplate.send(recordEventsTopic, event.getUserId().toString(), event.getPayload())
                        .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);

                event.markPublished(clock.instant());
                log.debug("Published outbox event {} ({}) to {}", event.getEventId(), event.getEventType(), recordEventsTopic);

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                event.recordFailure("interrupted", maxAttempts);
                outboxEventRepository.save(event);
                log.warn("Outbox publishing interrupted at event {}", event.getEventId());
                return;

            } catch (ExecutionException | TimeoutException | RuntimeException e) {
                event.recordFailure(e.getMessage(), maxAttempts);
                log.error("Failed to publish outbox event {} (attempt {}/{}): {}",
                        event.getEventId(), event.getAttempts(), maxAttempts, e.getMessage());
            }
            outboxEventRepository.save(event);
        }
    }
}
