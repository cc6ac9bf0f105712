package com.flagship.pocket_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.movements: movement mutations, tagged by operation, type and outcome
 * - ledger.operation.latency: latency per engine operation
 * - ledger.movements.orphaned: movements orphaned by cascade deletes
 * - ledger.movements.restored: orphan restoration outcomes
 * - ledger.cascade.deletes: cascade deletions by entity
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter movementsOrphaned;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.movementsOrphaned = Counter.builder("ledger.movements.orphaned")
                .description("Number of movements orphaned by parent deletion")
                .register(registry);
    }

    public void recordMovement(String operation, String type, String outcome) {
        registry.counter("ledger.movements",
                "operation", sanitizeTag(operation),
                "type", sanitizeTag(type),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        Timer.builder("ledger.operation.latency")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordOrphaned(int count) {
        movementsOrphaned.increment(count);
    }

    public void recordRestoration(int restored, int failed) {
        registry.counter("ledger.movements.restored", "result", "restored").increment(restored);
        registry.counter("ledger.movements.restored", "result", "failed").increment(failed);
    }

    public void recordCascadeDelete(String entity, boolean hardDelete) {
        registry.counter("ledger.cascade.deletes",
                "entity", sanitizeTag(entity),
                "hard_delete", String.valueOf(hardDelete)
        ).increment();
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
