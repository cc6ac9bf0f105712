package com.flagship.pocket_ledger.config;

import com.flagship.pocket_ledger.price.CachingPriceLookup;
import com.flagship.pocket_ledger.price.ConfiguredPriceSource;
import com.flagship.pocket_ledger.price.PriceLookup;
import com.flagship.pocket_ledger.price.PriceSource;
import com.flagship.pocket_ledger.price.TtlCache;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Wiring for the collaborators the ledger core consumes.
 *
 * The price cache is an ordinary bean built from the injected clock and configured TTL;
 * nothing in the ledger reaches for static cache state.
 */
@Configuration
public class LedgerConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public PriceSource priceSource(LedgerProperties properties) {
        return new ConfiguredPriceSource(properties.prices());
    }

    @Bean
    public TtlCache<String, BigDecimal> priceCache(Clock clock, LedgerProperties properties) {
        return new TtlCache<>(clock, properties.priceCacheTtl(), properties.priceCacheMaxSize());
    }

    @Bean
    public PriceLookup priceLookup(PriceSource priceSource, TtlCache<String, BigDecimal> priceCache) {
        return new CachingPriceLookup(priceSource, priceCache);
    }
}
