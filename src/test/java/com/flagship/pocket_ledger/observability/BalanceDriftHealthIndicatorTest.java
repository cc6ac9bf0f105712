package com.flagship.pocket_ledger.observability;

import com.flagship.pocket_ledger.account.Account;
import com.flagship.pocket_ledger.movement.MovementType;
import com.flagship.pocket_ledger.pocket.Pocket;
import com.flagship.pocket_ledger.support.LedgerFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class BalanceDriftHealthIndicatorTest {

    @Test
    @DisplayName("Healthy while stored balances match derived ones; warns on drift")
    void reportsDrift() {
        LedgerFixture ledger = new LedgerFixture();
        Account main = ledger.normalAccount("Main");
        Pocket cash = ledger.pocket(main, "Cash");
        ledger.movement(MovementType.INCOME_NORMAL, cash, "10");
        BalanceDriftHealthIndicator indicator = new BalanceDriftHealthIndicator(ledger.recomputeService);

        assertEquals(Status.UP, indicator.health().getStatus());

        ledger.accountStore.update(ledger.accountService.get(main.getId()).withBalance(new BigDecimal("11")));
        Health health = indicator.health();

        assertEquals("WARNING", health.getStatus().getCode());
        assertEquals(1, health.getDetails().get("drifted"));
    }
}
