package com.flagship.pocket_ledger.observability;

import com.flagship.pocket_ledger.balance.BalanceDrift;
import com.flagship.pocket_ledger.balance.BalanceRecomputeService;
import com.flagship.pocket_ledger.error.LedgerException;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reports stored balances that no longer match their derived value.
 * Any drift means a write bypassed the recompute pass.
 */
@Component("balanceDrift")
public class BalanceDriftHealthIndicator implements HealthIndicator {

    private static final int MAX_REPORTED = 10;

    private final BalanceRecomputeService recomputeService;

    public BalanceDriftHealthIndicator(BalanceRecomputeService recomputeService) {
        this.recomputeService = recomputeService;
    }

    @Override
    public Health health() {
        try {
            List<BalanceDrift> drift = recomputeService.findDrift();
            if (drift.isEmpty()) {
                return Health.up().withDetail("drifted", 0).build();
            }
            return Health.status("WARNING")
                    .withDetail("drifted", drift.size())
                    .withDetail("samples", drift.stream()
                            .limit(MAX_REPORTED)
                            .map(d -> String.format("%s %s: stored=%s derived=%s",
                                    d.getEntity(), d.getId(), d.getStored(), d.getDerived()))
                            .toList())
                    .build();
        } catch (LedgerException e) {
            return Health.down()
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
