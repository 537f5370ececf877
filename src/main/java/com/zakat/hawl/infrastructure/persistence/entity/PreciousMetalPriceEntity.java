package com.zakat.hawl.infrastructure.persistence.entity;

import com.zakat.hawl.domain.model.MetalType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Cached price feed reading. Newer fetches add rows; older rows are superseded, not deleted.
 */
@Entity
@Table(name = "precious_metal_prices", indexes = {
    @Index(name = "idx_price_metal_currency_fetched", columnList = "metal,currency,fetchedAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreciousMetalPriceEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID priceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private MetalType metal;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal pricePerGram;

    @Column(nullable = false)
    private Instant fetchedAt;

    @Column(nullable = false)
    private Instant expiresAt;

    @Column(nullable = false, length = 50)
    private String source;

    @PrePersist
    protected void onCreate() {
        if (priceId == null) {
            priceId = UUID.randomUUID();
        }
    }

    public boolean isExpiredAt(Instant instant) {
        return !instant.isBefore(expiresAt);
    }
}
