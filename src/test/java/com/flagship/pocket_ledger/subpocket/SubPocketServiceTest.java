package com.flagship.pocket_ledger.subpocket;

import com.flagship.pocket_ledger.error.IntegrityViolationException;
import com.flagship.pocket_ledger.error.InvalidAmountException;
import com.flagship.pocket_ledger.error.NotFoundException;
import com.flagship.pocket_ledger.support.InMemorySubPocketStore;
import com.flagship.pocket_ledger.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static com.flagship.pocket_ledger.support.Amounts.assertAmount;
import static org.junit.jupiter.api.Assertions.*;

class SubPocketServiceTest {

    private static final Instant CREATED_AT = Instant.parse("2024-03-15T10:00:00Z");

    private SubPocketService subPocketService;
    private UUID pocketId;

    @BeforeEach
    void setUp() {
        subPocketService = new SubPocketService(new InMemorySubPocketStore(), new MutableClock(CREATED_AT));
        pocketId = UUID.randomUUID();
    }

    @Test
    @DisplayName("Names are unique within a pocket, ignoring case")
    void uniqueNameIgnoringCase() {
        subPocketService.create(pocketId, "Rent", new BigDecimal("1000"), 1);

        assertThrows(IntegrityViolationException.class,
            () -> subPocketService.create(pocketId, "  rent ", new BigDecimal("500"), 1));
        assertDoesNotThrow(() -> subPocketService.create(UUID.randomUUID(), "Rent", new BigDecimal("500"), 1));
    }

    @Test
    @DisplayName("Target and periodicity must be positive")
    void rejectsNonPositiveTerms() {
        assertThrows(InvalidAmountException.class,
            () -> subPocketService.create(pocketId, "Rent", BigDecimal.ZERO, 1));
        assertThrows(InvalidAmountException.class,
            () -> subPocketService.create(pocketId, "Rent", new BigDecimal("100"), 0));
        assertThrows(IllegalArgumentException.class,
            () -> subPocketService.create(pocketId, " ", new BigDecimal("100"), 1));
    }

    @Test
    @DisplayName("Updating terms keeps the balance")
    void updateKeepsBalance() {
        SubPocket rent = subPocketService.create(pocketId, "Rent", new BigDecimal("1000"), 1);
        subPocketService.applyDelta(rent.getId(), new BigDecimal("250"));

        SubPocket updated = subPocketService.update(rent.getId(), null, new BigDecimal("1200"), 2);

        assertEquals("Rent", updated.getName());
        assertAmount("1200", updated.getTargetValue());
        assertEquals(2, updated.getPeriodicityMonths());
        assertAmount("250", updated.getBalance());
    }

    @Test
    @DisplayName("Monthly summary covers enabled sub-pockets only")
    void monthlySummary() {
        subPocketService.create(pocketId, "Rent", new BigDecimal("1000"), 1);
        SubPocket insurance = subPocketService.create(pocketId, "Insurance", new BigDecimal("1200"), 12);
        SubPocket gym = subPocketService.create(pocketId, "Gym", new BigDecimal("600"), 12);
        subPocketService.applyDelta(insurance.getId(), new BigDecimal("-500"));
        subPocketService.toggleEnabled(gym.getId());

        FixedExpenseSummary summary = subPocketService.monthlySummary(pocketId);

        assertEquals(2, summary.getEnabledCount());
        assertAmount("1100.00", summary.getTotalMonthly());
        assertAmount("1600.00", summary.getTotalRequired());
    }

    @Test
    @DisplayName("Applying a delta to a missing sub-pocket is a no-op")
    void applyDeltaToMissing() {
        assertTrue(subPocketService.applyDelta(UUID.randomUUID(), BigDecimal.ONE).isEmpty());
        assertThrows(NotFoundException.class, () -> subPocketService.get(UUID.randomUUID()));
    }
}
