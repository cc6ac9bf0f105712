package com.flagship.pocket_ledger.movement;

import com.flagship.pocket_ledger.account.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Movement domain object: one signed money event against a pocket or sub-pocket.
 *
 * State machine:
 * - PENDING -> APPLIED (via applyPending)
 * - APPLIED -> ORPHANED (parent deleted, effect left in history only)
 * - ORPHANED -> APPLIED / PENDING (re-homed onto live parents)
 *
 * A movement contributes to ledger balances only while it is neither pending nor orphaned.
 * The orphan snapshot keeps parent names so the movement can be matched again later.
 */
@Value
public class Movement {
    UUID id;
    MovementType type;
    UUID accountId;
    UUID pocketId;
    UUID subPocketId;
    BigDecimal amount;
    String notes;
    LocalDate displayedDate;
    Instant createdAt;
    boolean pending;
    boolean orphaned;
    OrphanReason orphanReason;
    String orphanedAccountName;
    CurrencyCode orphanedAccountCurrency;
    String orphanedPocketName;
    String orphanedSubPocketName;

    public static Movement create(UUID id, CreateMovementCommand command, Instant now) {
        LocalDate displayed = command.getDisplayedDate() != null
            ? command.getDisplayedDate()
            : LocalDate.ofInstant(now, ZoneOffset.UTC);
        return new Movement(id, command.getType(), command.getAccountId(), command.getPocketId(),
            command.getSubPocketId(), command.getAmount(), command.getNotes(), displayed, now,
            command.isPending(), false, null, null, null, null, null);
    }

    /**
     * True when this movement currently contributes to ledger balances.
     */
    public boolean isEffective() {
        return !pending && !orphaned;
    }

    public BigDecimal signedAmount() {
        return type.signed(amount);
    }

    /**
     * PENDING -> APPLIED.
     *
     * @throws IllegalStateException if the movement is not pending
     */
    public Movement applied() {
        if (!pending) {
            throw new IllegalStateException(String.format("Movement %s is not pending", id));
        }
        return new Movement(id, type, accountId, pocketId, subPocketId, amount, notes, displayedDate, createdAt,
            false, orphaned, orphanReason, orphanedAccountName, orphanedAccountCurrency, orphanedPocketName,
            orphanedSubPocketName);
    }

    /**
     * Marks this movement orphaned, recording the parent names for later restoration.
     */
    public Movement orphan(OrphanReason reason, String accountName, CurrencyCode accountCurrency,
                           String pocketName, String subPocketName) {
        return new Movement(id, type, accountId, pocketId, subPocketId, amount, notes, displayedDate, createdAt,
            pending, true, reason, accountName, accountCurrency, pocketName, subPocketName);
    }

    /**
     * Re-homes an orphaned movement onto live parents and clears the orphan snapshot.
     */
    public Movement restore(UUID newAccountId, UUID newPocketId, UUID newSubPocketId) {
        return new Movement(id, type, newAccountId, newPocketId, newSubPocketId, amount, notes, displayedDate,
            createdAt, pending, false, null, null, null, null, null);
    }

    /**
     * Applies a partial update; null fields keep their current value.
     */
    public Movement withChanges(MovementUpdate update) {
        UUID newSubPocketId = update.isClearSubPocket()
            ? null
            : update.getSubPocketId() != null ? update.getSubPocketId() : subPocketId;
        return new Movement(
            id,
            update.getType() != null ? update.getType() : type,
            update.getAccountId() != null ? update.getAccountId() : accountId,
            update.getPocketId() != null ? update.getPocketId() : pocketId,
            newSubPocketId,
            update.getAmount() != null ? update.getAmount() : amount,
            update.getNotes() != null ? update.getNotes() : notes,
            update.getDisplayedDate() != null ? update.getDisplayedDate() : displayedDate,
            createdAt, pending, orphaned, orphanReason, orphanedAccountName, orphanedAccountCurrency,
            orphanedPocketName, orphanedSubPocketName);
    }
}
