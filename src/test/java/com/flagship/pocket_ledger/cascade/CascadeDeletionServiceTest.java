package com.flagship.pocket_ledger.cascade;

import com.flagship.pocket_ledger.account.Account;
import com.flagship.pocket_ledger.account.CurrencyCode;
import com.flagship.pocket_ledger.error.IntegrityViolationException;
import com.flagship.pocket_ledger.error.NotFoundException;
import com.flagship.pocket_ledger.movement.Movement;
import com.flagship.pocket_ledger.movement.MovementType;
import com.flagship.pocket_ledger.movement.OrphanReason;
import com.flagship.pocket_ledger.pocket.Pocket;
import com.flagship.pocket_ledger.subpocket.SubPocket;
import com.flagship.pocket_ledger.support.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.flagship.pocket_ledger.support.Amounts.assertAmount;
import static org.junit.jupiter.api.Assertions.*;

class CascadeDeletionServiceTest {

    private LedgerFixture ledger;
    private CascadeDeletionService cascadeService;
    private Account main;
    private Pocket cash;

    @BeforeEach
    void setUp() {
        ledger = new LedgerFixture();
        cascadeService = ledger.cascadeService;
        main = ledger.normalAccount("Main");
        cash = ledger.pocket(main, "Cash");
        ledger.movement(MovementType.INCOME_NORMAL, cash, "100");
        ledger.movement(MovementType.EXPENSE_NORMAL, cash, "30");
    }

    @Nested
    @DisplayName("Account")
    class AccountDeletion {

        @Test
        @DisplayName("By default movements survive as orphans with a name snapshot")
        void orphansByDefault() {
            CascadeDeleteResult result = cascadeService.deleteAccount(main.getId());

            assertEquals(new CascadeDeleteResult("Main", 1, 0, 2), result);
            assertThrows(NotFoundException.class, () -> ledger.accountService.get(main.getId()));
            assertTrue(ledger.pocketService.find(cash.getId()).isEmpty());

            List<Movement> orphans = ledger.movementService.findOrphaned();
            assertEquals(2, orphans.size());
            for (Movement orphan : orphans) {
                assertEquals(OrphanReason.ACCOUNT, orphan.getOrphanReason());
                assertEquals("Main", orphan.getOrphanedAccountName());
                assertEquals(CurrencyCode.USD, orphan.getOrphanedAccountCurrency());
                assertEquals("Cash", orphan.getOrphanedPocketName());
                assertFalse(orphan.isEffective());
            }
            assertTrue(ledger.movementService.findByAccount(main.getId()).isEmpty());
        }

        @Test
        @DisplayName("Hard delete leaves no movement referencing the account")
        void hardDelete() {
            CascadeDeleteResult result = cascadeService.deleteAccount(main.getId(), true);

            assertEquals(2, result.getMovements());
            assertTrue(ledger.movementStore.findByAccountId(main.getId()).isEmpty());
            assertTrue(ledger.movementService.findOrphaned().isEmpty());
        }

        @Test
        @DisplayName("Sub-pockets of the fixed pocket are deleted too")
        void withFixedPocket() {
            Pocket fixed = ledger.fixedPocket(main);
            SubPocket rent = ledger.subPocket(fixed, "Rent", "1000", 1);
            ledger.subPocket(fixed, "Gym", "600", 12);
            ledger.fixedMovement(MovementType.EXPENSE_FIXED, rent, "50");

            CascadeDeleteResult result = cascadeService.deleteAccount(main.getId());

            assertEquals(new CascadeDeleteResult("Main", 2, 2, 3), result);
            assertTrue(ledger.subPocketStore.findAll().isEmpty());
            Movement fixedOrphan = ledger.movementStore.findBySubPocketId(rent.getId()).get(0);
            assertEquals("Rent", fixedOrphan.getOrphanedSubPocketName());
            assertTrue(ledger.pocketService.findFixedPocket().isEmpty());
        }

        @Test
        @DisplayName("Other accounts are untouched")
        void otherAccountsUntouched() {
            Account other = ledger.normalAccount("Other");
            Pocket wallet = ledger.pocket(other, "Wallet");
            ledger.movement(MovementType.INCOME_NORMAL, wallet, "5");

            cascadeService.deleteAccount(main.getId());

            assertAmount("5", ledger.accountBalance(other.getId()));
            assertEquals(1, ledger.movementService.findByAccount(other.getId()).size());
        }
    }

    @Nested
    @DisplayName("Pocket")
    class PocketDeletion {

        @Test
        @DisplayName("Deleting a pocket orphans its movements and recomputes the account")
        void orphansAndRecomputes() {
            Pocket savings = ledger.pocket(main, "Savings");
            ledger.movement(MovementType.INCOME_NORMAL, savings, "40");
            assertAmount("110", ledger.accountBalance(main.getId()));

            CascadeDeleteResult result = cascadeService.deletePocket(cash.getId());

            assertEquals(new CascadeDeleteResult("Cash", 1, 0, 2), result);
            assertAmount("40", ledger.accountBalance(main.getId()));
            assertTrue(ledger.movementService.findOrphaned().stream()
                .allMatch(m -> m.getOrphanReason() == OrphanReason.POCKET));
        }

        @Test
        @DisplayName("Hard delete removes the pocket's movements")
        void hardDelete() {
            cascadeService.deletePocket(cash.getId(), true);

            assertTrue(ledger.movementStore.findAll().isEmpty());
            assertAmount("0", ledger.accountBalance(main.getId()));
        }

        @Test
        @DisplayName("A fixed pocket with sub-pockets cannot be deleted")
        void fixedWithSubPockets() {
            Pocket fixed = ledger.fixedPocket(main);
            SubPocket rent = ledger.subPocket(fixed, "Rent", "1000", 1);

            assertThrows(IntegrityViolationException.class, () -> cascadeService.deletePocket(fixed.getId()));

            cascadeService.deleteSubPocket(rent.getId());
            assertDoesNotThrow(() -> cascadeService.deletePocket(fixed.getId()));
        }
    }

    @Test
    @DisplayName("Deleting a sub-pocket orphans its movements and rolls the fixed pocket back")
    void deleteSubPocket() {
        Pocket fixed = ledger.fixedPocket(main);
        SubPocket rent = ledger.subPocket(fixed, "Rent", "1000", 1);
        SubPocket gym = ledger.subPocket(fixed, "Gym", "600", 12);
        ledger.fixedMovement(MovementType.INCOME_FIXED, rent, "300");
        ledger.fixedMovement(MovementType.INCOME_FIXED, gym, "20");
        assertAmount("320", ledger.pocketBalance(fixed.getId()));

        CascadeDeleteResult result = cascadeService.deleteSubPocket(rent.getId());

        assertEquals(1, result.getMovements());
        assertAmount("20", ledger.pocketBalance(fixed.getId()));
        assertAmount("90", ledger.accountBalance(main.getId()));
        Movement orphan = ledger.movementService.findOrphaned().get(0);
        assertEquals(OrphanReason.SUB_POCKET, orphan.getOrphanReason());
        assertEquals("Rent", orphan.getOrphanedSubPocketName());
    }
}
