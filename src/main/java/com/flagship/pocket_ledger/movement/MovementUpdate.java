package com.flagship.pocket_ledger.movement;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Partial update for a movement. Null fields are left unchanged; set
 * {@code clearSubPocket} to detach the movement from its sub-pocket.
 */
@Value
@Builder
public class MovementUpdate {
    MovementType type;
    UUID accountId;
    UUID pocketId;
    UUID subPocketId;
    boolean clearSubPocket;
    BigDecimal amount;
    String notes;
    LocalDate displayedDate;

    /**
     * True when the update names a new parent, which re-homes an orphaned movement.
     */
    public boolean movesParent() {
        return accountId != null || pocketId != null;
    }
}
