package com.flagship.pocket_ledger.subpocket;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static com.flagship.pocket_ledger.support.Amounts.assertAmount;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Amortization math for recurring obligations, including debt and overpayment.
 */
class SubPocketTest {

    private SubPocket insurance() {
        return SubPocket.create(UUID.randomUUID(), UUID.randomUUID(), "Insurance", new BigDecimal("1200"), 12,
            Instant.EPOCH);
    }

    @Test
    @DisplayName("Monthly amount is target over periodicity")
    void monthlyAmount() {
        assertAmount("100.00", insurance().monthlyAmount());
        SubPocket odd = SubPocket.create(UUID.randomUUID(), UUID.randomUUID(), "Odd", new BigDecimal("100"), 3, Instant.EPOCH);
        assertEquals(new BigDecimal("33.33"), odd.monthlyAmount());
    }

    @Nested
    @DisplayName("Debt")
    class Debt {

        @Test
        @DisplayName("Negative balance adds the deficit to the installment")
        void debtRequiresInstallmentPlusDeficit() {
            SubPocket inDebt = insurance().applyDelta(new BigDecimal("-500"));

            assertAmount("-500", inDebt.getBalance());
            assertAmount("600.00", inDebt.requiredContribution());
            assertEquals(new BigDecimal("-0.4167"), inDebt.progress());
        }

        @Test
        @DisplayName("Paying off the debt returns to the regular installment")
        void recoveringFromDebt() {
            SubPocket recovered = insurance()
                .applyDelta(new BigDecimal("-500"))
                .applyDelta(new BigDecimal("1500"));

            assertAmount("1000", recovered.getBalance());
            assertAmount("100.00", recovered.requiredContribution());
            assertEquals(new BigDecimal("0.8333"), recovered.progress());
        }
    }

    @Nested
    @DisplayName("Overpayment")
    class Overpayment {

        @Test
        @DisplayName("Less than one installment left requires only the remainder")
        void nearlyFunded() {
            SubPocket nearly = insurance().applyDelta(new BigDecimal("1150"));
            assertAmount("50", nearly.requiredContribution());
        }

        @Test
        @DisplayName("Balance above target requires nothing and progress exceeds one")
        void overpaid() {
            SubPocket overpaid = insurance()
                .applyDelta(new BigDecimal("1000"))
                .applyDelta(new BigDecimal("12000"));

            assertAmount("13000", overpaid.getBalance());
            assertAmount("0", overpaid.requiredContribution());
            assertEquals(new BigDecimal("10.8333"), overpaid.progress());
        }
    }

    @Test
    @DisplayName("Disabled sub-pockets require nothing")
    void disabledRequiresNothing() {
        SubPocket disabled = insurance().applyDelta(new BigDecimal("-500")).toggled();

        assertFalse(disabled.isEnabled());
        assertAmount("0", disabled.requiredContribution());
        assertTrue(disabled.toggled().isEnabled());
    }
}
