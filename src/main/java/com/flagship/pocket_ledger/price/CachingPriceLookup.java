package com.flagship.pocket_ledger.price;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * {@link PriceLookup} backed by a {@link TtlCache} in front of a {@link PriceSource}.
 *
 * Source failures are logged and reported as "no price"; the caller decides the
 * fallback valuation.
 */
@Slf4j
public class CachingPriceLookup implements PriceLookup {

    private final PriceSource source;
    private final TtlCache<String, BigDecimal> cache;

    public CachingPriceLookup(PriceSource source, TtlCache<String, BigDecimal> cache) {
        this.source = source;
        this.cache = cache;
    }

    @Override
    public Optional<BigDecimal> currentPrice(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return Optional.empty();
        }
        String key = symbol.trim().toUpperCase();

        Optional<BigDecimal> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Price cache hit for {}", key);
            return cached;
        }

        try {
            Optional<BigDecimal> fetched = source.fetch(key);
            fetched.ifPresent(price -> cache.put(key, price));
            log.debug("Price cache miss for {}: fetched={}", key, fetched.orElse(null));
            return fetched;
        } catch (RuntimeException e) {
            log.warn("Price source failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
