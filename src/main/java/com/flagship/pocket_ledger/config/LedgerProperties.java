package com.flagship.pocket_ledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

/**
 * Ledger configuration bound from {@code ledger.*}.
 *
 * @param priceCacheTtl     freshness window for market prices (default 15 minutes)
 * @param priceCacheMaxSize upper bound on cached symbols
 * @param prices            fixed quotes per stock symbol, used when no market feed is wired in
 */
@ConfigurationProperties(prefix = "ledger")
public record LedgerProperties(
        Duration priceCacheTtl,
        Long priceCacheMaxSize,
        Map<String, BigDecimal> prices
) {

    public static final Duration DEFAULT_PRICE_CACHE_TTL = Duration.ofMinutes(15);
    public static final long DEFAULT_PRICE_CACHE_MAX_SIZE = 1_000;

    public LedgerProperties {
        if (priceCacheTtl == null) {
            priceCacheTtl = DEFAULT_PRICE_CACHE_TTL;
        }
        if (priceCacheTtl.isNegative() || priceCacheTtl.isZero()) {
            throw new IllegalArgumentException("ledger.price-cache-ttl must be positive");
        }
        if (priceCacheMaxSize == null) {
            priceCacheMaxSize = DEFAULT_PRICE_CACHE_MAX_SIZE;
        }
        if (priceCacheMaxSize <= 0) {
            throw new IllegalArgumentException("ledger.price-cache-max-size must be positive");
        }
        prices = prices == null ? Map.of() : Map.copyOf(prices);
    }
}
