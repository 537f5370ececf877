package com.zakat.hawl.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Read-only mapping of the asset store's table. Asset CRUD lives in another service;
 * this engine only reads zakat-eligible rows.
 */
@Entity
@Immutable
@Table(name = "assets")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class AssetEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID assetId;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID userId;

    @Column(length = 255)
    private String name;

    @Column(length = 50)
    private String category;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String encryptedValue;

    @Column(precision = 9, scale = 4)
    private BigDecimal calculationModifier;

    @Column(nullable = false)
    private boolean zakatEligible;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false)
    private Instant createdAt;
}
