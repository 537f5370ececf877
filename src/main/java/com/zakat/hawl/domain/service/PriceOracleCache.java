package com.zakat.hawl.domain.service;

import com.zakat.hawl.domain.exception.PriceUnavailableException;
import com.zakat.hawl.domain.model.MetalType;
import com.zakat.hawl.domain.model.NisabBasis;
import com.zakat.hawl.domain.model.PriceSource;
import com.zakat.hawl.domain.model.ThresholdResult;
import com.zakat.hawl.infrastructure.persistence.entity.PreciousMetalPriceEntity;
import com.zakat.hawl.infrastructure.persistence.repository.PreciousMetalPriceRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Nisab threshold lookup backed by a persistent price cache.
 *
 * Lookup order:
 * 1. Latest non-expired cache row for the metal/currency pair
 * 2. Fresh fetch from the price feed, persisted as a new row
 * 3. Latest cache row regardless of expiry (degraded mode)
 * 4. {@link PriceUnavailableException}
 *
 * Fetches are single-writer per metal/currency key. This is the only writer of the
 * price cache table.
 */
@Slf4j
@Service
public class PriceOracleCache {

    private static final int THRESHOLD_SCALE = 2;

    private final PreciousMetalPriceRepository priceRepository;
    private final PriceFeed priceFeed;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Duration ttl;

    private final ConcurrentMap<String, Object> fetchLocks = new ConcurrentHashMap<>();

    public PriceOracleCache(PreciousMetalPriceRepository priceRepository,
                            PriceFeed priceFeed,
                            MeterRegistry meterRegistry,
                            Clock clock,
                            @Value("${app.price-cache.ttl-hours:24}") long ttlHours) {
        this.priceRepository = priceRepository;
        this.priceFeed = priceFeed;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.ttl = Duration.ofHours(ttlHours);
    }

    public ThresholdResult getNisabThreshold(String currency, NisabBasis basis) {
        String normalizedCurrency = currency.toUpperCase(Locale.ROOT);
        MetalType metal = basis.getMetal();

        Optional<PreciousMetalPriceEntity> cached = findUsable(metal, normalizedCurrency);
        if (cached.isPresent()) {
            return toThreshold(basis, cached.get(), PriceSource.CACHED);
        }

        Object lock = fetchLocks.computeIfAbsent(metal + ":" + normalizedCurrency, key -> new Object());
        synchronized (lock) {
            // Another caller may have refreshed the row while we waited
            cached = findUsable(metal, normalizedCurrency);
            if (cached.isPresent()) {
                return toThreshold(basis, cached.get(), PriceSource.CACHED);
            }
            return fetchOrFallback(basis, normalizedCurrency);
        }
    }

    private ThresholdResult fetchOrFallback(NisabBasis basis, String currency) {
        MetalType metal = basis.getMetal();
        try {
            BigDecimal pricePerGram = priceFeed.fetchPricePerGram(metal, currency);
            Instant now = clock.instant();

            PreciousMetalPriceEntity fresh = priceRepository.save(PreciousMetalPriceEntity.builder()
                    .metal(metal)
                    .currency(currency)
                    .pricePerGram(pricePerGram)
                    .fetchedAt(now)
                    .expiresAt(now.plus(ttl))
                    .source(priceFeed.sourceName())
                    .build());

            log.debug("Cached fresh {} price in {} until {}", metal, currency, fresh.getExpiresAt());
            return toThreshold(basis, fresh, PriceSource.FRESH);

        } catch (RuntimeException e) {
            Optional<PreciousMetalPriceEntity> stale =
                    priceRepository.findFirstByMetalAndCurrencyOrderByFetchedAtDesc(metal, currency);

            if (stale.isEmpty()) {
                log.error("Price feed failed for {}/{} and no cached price exists: {}", metal, currency, e.getMessage());
                countLookup("unavailable");
                throw new PriceUnavailableException(metal, currency, e);
            }

            log.warn("Price feed failed for {}/{}, using cached price fetched at {} (degraded mode): {}",
                    metal, currency, stale.get().getFetchedAt(), e.getMessage());
            return toThreshold(basis, stale.get(), PriceSource.STALE_FALLBACK);
        }
    }

    private Optional<PreciousMetalPriceEntity> findUsable(MetalType metal, String currency) {
        Instant now = clock.instant();
        return priceRepository.findFirstByMetalAndCurrencyOrderByFetchedAtDesc(metal, currency)
                .filter(price -> !price.isExpiredAt(now));
    }

    private ThresholdResult toThreshold(NisabBasis basis, PreciousMetalPriceEntity price, PriceSource source) {
        countLookup(source.name().toLowerCase(Locale.ROOT));

        BigDecimal threshold = basis.getNisabGrams()
                .multiply(price.getPricePerGram())
                .setScale(THRESHOLD_SCALE, RoundingMode.HALF_UP);

        return ThresholdResult.builder()
                .basis(basis)
                .currency(price.getCurrency())
                .pricePerGram(price.getPricePerGram())
                .thresholdValue(threshold)
                .priceFetchedAt(price.getFetchedAt())
                .source(source)
                .build();
    }

    private void countLookup(String source) {
        Counter.builder("nisab.price.lookup")
                .tag("source", source)
                .register(meterRegistry)
                .increment();
    }
}
