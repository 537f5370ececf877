package com.zakat.hawl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Nisab threshold and Hawl lifecycle engine.
 *
 * - Prices the Nisab threshold from cached gold/silver spot prices
 * - Tracks each user's lunar-year observation window against it
 * - Manages the draft/finalized/unlocked record lifecycle with an append-only audit trail
 * - Relays lifecycle events to Kafka through a transactional outbox
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableScheduling
public class HawlEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(HawlEngineApplication.class, args);
    }
}
