package com.flagship.pocket_ledger.observability;

import com.flagship.pocket_ledger.error.LedgerException;
import com.flagship.pocket_ledger.movement.MovementStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Gauges for movement backlog: pending and orphaned counts.
 *
 * Values are cached and refreshed by {@link MetricsScheduler} so scrapes never query
 * the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerGauges {

    private final MovementStore movementStore;
    private final MeterRegistry meterRegistry;

    private final AtomicLong pendingCount = new AtomicLong(0);
    private final AtomicLong orphanedCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("ledger.movements.backlog", pendingCount, AtomicLong::get)
                .description("Movements recorded but not yet applied")
                .tag("state", "pending")
                .register(meterRegistry);

        Gauge.builder("ledger.movements.backlog", orphanedCount, AtomicLong::get)
                .description("Movements whose parent was deleted")
                .tag("state", "orphaned")
                .register(meterRegistry);

        log.info("Ledger gauges registered with Micrometer");
    }

    /**
     * Refreshes the cached values. A store failure keeps the previous values.
     */
    public void refresh() {
        try {
            pendingCount.set(movementStore.countPending());
            orphanedCount.set(movementStore.countOrphaned());
            log.debug("Ledger gauges refreshed: pending={}, orphaned={}", pendingCount.get(), orphanedCount.get());
        } catch (LedgerException e) {
            log.warn("Failed to refresh ledger gauges: {}", e.getMessage());
        }
    }

    long pending() {
        return pendingCount.get();
    }

    long orphaned() {
        return orphanedCount.get();
    }
}
