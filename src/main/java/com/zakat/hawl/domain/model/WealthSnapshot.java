package com.zakat.hawl.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * A user's zakatable wealth at a point in time. Only {@link #total} takes part in threshold
 * comparison; the breakdown is kept for audit and reporting.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WealthSnapshot {

    private UUID userId;
    private BigDecimal total;

    @Builder.Default
    private Map<AssetCategory, BigDecimal> breakdown = new EnumMap<>(AssetCategory.class);

    private int assetCount;
    private Instant calculatedAt;

    public static WealthSnapshot empty(UUID userId, Instant at) {
        return WealthSnapshot.builder()
                .userId(userId)
                .total(BigDecimal.ZERO)
                .assetCount(0)
                .calculatedAt(at)
                .build();
    }

    public boolean meets(BigDecimal threshold) {
        return total.compareTo(threshold) >= 0;
    }
}
