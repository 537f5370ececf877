package com.zakat.hawl.domain.service;

import com.zakat.hawl.domain.model.AssetCategory;
import com.zakat.hawl.domain.model.StoredAsset;
import com.zakat.hawl.domain.model.WealthSnapshot;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Sums a user's zakat-eligible assets into a {@link WealthSnapshot}.
 *
 * All asset values are decrypted in one batch. Each value is scaled by the asset's
 * calculation modifier before it is added to its category.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WealthAggregator {

    private static final long SLOW_AGGREGATION_MS = 100;

    private final AssetStore assetStore;
    private final EncryptionService encryptionService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public WealthSnapshot aggregateZakatableWealth(UUID userId) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startNanos = System.nanoTime();

        List<StoredAsset> assets = assetStore.findZakatableAssets(userId);
        if (assets.isEmpty()) {
            stop(sample, userId, startNanos, 0);
            return WealthSnapshot.empty(userId, clock.instant());
        }

        List<String> plaintextValues = encryptionService.decryptAll(assets.stream()
                .map(StoredAsset::getEncryptedValue)
                .collect(Collectors.toList()));

        Map<AssetCategory, BigDecimal> breakdown = new EnumMap<>(AssetCategory.class);
        BigDecimal total = BigDecimal.ZERO;

        for (int i = 0; i < assets.size(); i++) {
            StoredAsset asset = assets.get(i);
            BigDecimal contribution = parseValue(asset, plaintextValues.get(i))
                    .multiply(modifierOf(asset));

            breakdown.merge(AssetCategory.fromLabel(asset.getCategory()), contribution, BigDecimal::add);
            total = total.add(contribution);
        }

        breakdown.replaceAll((category, value) -> value.setScale(2, RoundingMode.HALF_UP));

        stop(sample, userId, startNanos, assets.size());

        return WealthSnapshot.builder()
                .userId(userId)
                .total(total.setScale(2, RoundingMode.HALF_UP))
                .breakdown(breakdown)
                .assetCount(assets.size())
                .calculatedAt(clock.instant())
                .build();
    }

    private BigDecimal parseValue(StoredAsset asset, String plaintext) {
        if (plaintext == null || plaintext.isBlank()) {
            throw new IllegalStateException("Asset " + asset.getAssetId() + " has no stored value");
        }
        try {
            return new BigDecimal(plaintext.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Asset " + asset.getAssetId() + " has a non-numeric value", e);
        }
    }

    private BigDecimal modifierOf(StoredAsset asset) {
        return asset.getCalculationModifier() != null ? asset.getCalculationModifier() : BigDecimal.ONE;
    }

    private void stop(Timer.Sample sample, UUID userId, long startNanos, int assetCount) {
        sample.stop(Timer.builder("wealth.aggregation.latency").register(meterRegistry));

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        if (elapsedMs > SLOW_AGGREGATION_MS) {
            log.warn("Slow wealth aggregation for user {}: {} ms over {} assets", userId, elapsedMs, assetCount);
        }
    }
}
