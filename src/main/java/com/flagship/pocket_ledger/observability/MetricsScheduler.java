package com.flagship.pocket_ledger.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically refreshes gauges that need a database query.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final LedgerGauges ledgerGauges;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshLedgerGauges() {
        ledgerGauges.refresh();
    }
}
