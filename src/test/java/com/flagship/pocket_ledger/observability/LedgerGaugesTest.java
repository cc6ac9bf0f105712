package com.flagship.pocket_ledger.observability;

import com.flagship.pocket_ledger.account.Account;
import com.flagship.pocket_ledger.error.PersistenceException;
import com.flagship.pocket_ledger.movement.MovementStore;
import com.flagship.pocket_ledger.movement.MovementType;
import com.flagship.pocket_ledger.pocket.Pocket;
import com.flagship.pocket_ledger.support.LedgerFixture;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LedgerGaugesTest {

    @Test
    @DisplayName("Gauges report pending and orphaned counts after a refresh")
    void refresh() {
        LedgerFixture ledger = new LedgerFixture();
        LedgerGauges gauges = new LedgerGauges(ledger.movementStore, ledger.meterRegistry);
        gauges.init();

        Account main = ledger.normalAccount("Main");
        Pocket cash = ledger.pocket(main, "Cash");
        ledger.pendingMovement(MovementType.INCOME_NORMAL, cash, "10");
        Pocket savings = ledger.pocket(main, "Savings");
        ledger.movement(MovementType.INCOME_NORMAL, savings, "10");
        ledger.cascadeService.deletePocket(savings.getId());

        new MetricsScheduler(gauges).refreshLedgerGauges();

        assertEquals(1.0, ledger.meterRegistry.get("ledger.movements.backlog").tag("state", "pending").gauge().value());
        assertEquals(1.0, ledger.meterRegistry.get("ledger.movements.backlog").tag("state", "orphaned").gauge().value());
        assertEquals(1.0, ledger.meterRegistry.get("ledger.movements.orphaned").counter().count());
    }

    @Test
    @DisplayName("A store failure keeps the previous values")
    void storeFailure() {
        MovementStore store = mock(MovementStore.class);
        when(store.countPending()).thenReturn(3L).thenThrow(new PersistenceException("down", new RuntimeException()));
        when(store.countOrphaned()).thenReturn(0L);
        LedgerGauges gauges = new LedgerGauges(store, new SimpleMeterRegistry());
        gauges.init();

        gauges.refresh();
        gauges.refresh();

        assertEquals(3, gauges.pending());
    }
}
