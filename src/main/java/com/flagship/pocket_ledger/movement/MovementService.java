package com.flagship.pocket_ledger.movement;

import com.flagship.pocket_ledger.account.Account;
import com.flagship.pocket_ledger.account.AccountService;
import com.flagship.pocket_ledger.balance.BalanceRecomputeService;
import com.flagship.pocket_ledger.error.IntegrityViolationException;
import com.flagship.pocket_ledger.error.InvalidAmountException;
import com.flagship.pocket_ledger.error.InvalidStateException;
import com.flagship.pocket_ledger.error.LedgerException;
import com.flagship.pocket_ledger.error.NotFoundException;
import com.flagship.pocket_ledger.observability.LedgerMetrics;
import com.flagship.pocket_ledger.pocket.Pocket;
import com.flagship.pocket_ledger.pocket.PocketService;
import com.flagship.pocket_ledger.subpocket.SubPocket;
import com.flagship.pocket_ledger.subpocket.SubPocketService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Movement engine: records movements and keeps every ledger balance consistent with them.
 *
 * Every mutation:
 * 1. Validates the amount and the target references before touching any balance
 * 2. Reverses the old effect (update, delete) and applies the new one (create, update, applyPending)
 * 3. Ends with one recompute pass per touched account
 *
 * Pending and orphaned movements have no ledger effect. All writes run through
 * {@link LedgerWriteLock}, so each operation is one serialized transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MovementService {

    /** Matches the NUMERIC scale of stored amounts and balances. */
    static final int MAX_AMOUNT_SCALE = 6;

    private final MovementStore movementStore;
    private final AccountService accountService;
    private final PocketService pocketService;
    private final SubPocketService subPocketService;
    private final BalanceRecomputeService recomputeService;
    private final LedgerWriteLock writeLock;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    /**
     * Records a movement. A non-pending movement is applied immediately.
     *
     * @throws InvalidAmountException if the amount is not positive
     * @throws NotFoundException if the account, pocket or sub-pocket does not exist
     * @throws IntegrityViolationException if the references do not fit together
     */
    public Movement create(CreateMovementCommand command) {
        return guarded("create", () -> {
            requirePositive(command.getAmount());
            Movement movement = Movement.create(UUID.randomUUID(), command, clock.instant());
            MDC.put("movementId", movement.getId().toString());
            MDC.put("accountId", String.valueOf(movement.getAccountId()));
            validateTargets(movement);

            Movement saved = movementStore.insert(movement);
            if (saved.isEffective()) {
                route(saved, saved.signedAmount());
            }
            recomputeService.recompute(saved.getAccountId());

            log.info("Movement created: type={}, amount={}, pending={}",
                saved.getType(), saved.getAmount(), saved.isPending());
            return saved;
        });
    }

    /**
     * Updates a movement so that the ledger ends up as if the old movement never existed
     * and the new one had been created.
     *
     * An orphaned movement that is given a new account or pocket is re-homed: the orphan
     * flag is cleared and its effect applied to the new parents.
     */
    public Movement update(UUID id, MovementUpdate update) {
        return guarded("update", () -> {
            MDC.put("movementId", id.toString());
            Movement old = get(id);
            Movement merged = old.withChanges(update);
            if (old.isOrphaned() && update.movesParent()) {
                merged = merged.restore(merged.getAccountId(), merged.getPocketId(), merged.getSubPocketId());
            }
            requirePositive(merged.getAmount());
            if (!merged.isOrphaned()) {
                validateTargets(merged);
            }

            reverse(old);
            Movement saved = movementStore.update(merged);
            if (saved.isEffective()) {
                route(saved, saved.signedAmount());
            }
            recomputeTouched(old, saved);

            log.info("Movement updated: type={} -> {}, amount={} -> {}",
                old.getType(), saved.getType(), old.getAmount(), saved.getAmount());
            return saved;
        });
    }

    /**
     * Deletes a movement, reversing its effect if it had one.
     */
    public void delete(UUID id) {
        guarded("delete", () -> {
            MDC.put("movementId", id.toString());
            Movement old = get(id);
            reverse(old);
            movementStore.delete(id);
            if (!old.isOrphaned()) {
                recomputeService.recomputeIfPresent(old.getAccountId());
            }
            log.info("Movement deleted: type={}, amount={}", old.getType(), old.getAmount());
            return old;
        });
    }

    /**
     * PENDING -> APPLIED. The reverse transition is not supported.
     *
     * @throws InvalidStateException if the movement is already applied or is orphaned
     */
    public Movement applyPending(UUID id) {
        return guarded("apply_pending", () -> {
            MDC.put("movementId", id.toString());
            Movement movement = get(id);
            if (!movement.isPending()) {
                throw new InvalidStateException(String.format("Movement %s is already applied", id));
            }
            if (movement.isOrphaned()) {
                throw new InvalidStateException(String.format(
                    "Movement %s is orphaned; restore it before applying", id));
            }
            validateTargets(movement);

            Movement applied = movementStore.update(movement.applied());
            route(applied, applied.signedAmount());
            recomputeService.recompute(applied.getAccountId());

            log.info("Pending movement applied: type={}, amount={}", applied.getType(), applied.getAmount());
            return applied;
        });
    }

    /**
     * Moves money between two pockets as an EXPENSE_NORMAL on the source and an
     * INCOME_NORMAL on the target. The pockets may belong to different accounts.
     */
    public TransferResult createTransfer(TransferCommand command) {
        requirePositive(command.getAmount());
        if (command.getSourcePocketId() == null || command.getTargetPocketId() == null) {
            throw new IllegalArgumentException("Source and target pockets are required");
        }
        if (command.getSourcePocketId().equals(command.getTargetPocketId())) {
            throw new IllegalArgumentException("Source and target pockets must be different");
        }

        return writeLock.execute(() -> {
            Pocket source = pocketService.get(command.getSourcePocketId());
            Pocket target = pocketService.get(command.getTargetPocketId());

            Movement expense = create(CreateMovementCommand.builder()
                .type(MovementType.EXPENSE_NORMAL)
                .accountId(source.getAccountId())
                .pocketId(source.getId())
                .amount(command.getAmount())
                .notes(transferNote("Transfer to " + target.getName(), command.getNotes()))
                .displayedDate(command.getDisplayedDate())
                .build());
            Movement income = create(CreateMovementCommand.builder()
                .type(MovementType.INCOME_NORMAL)
                .accountId(target.getAccountId())
                .pocketId(target.getId())
                .amount(command.getAmount())
                .notes(transferNote("Transfer from " + source.getName(), command.getNotes()))
                .displayedDate(command.getDisplayedDate())
                .build());

            log.info("Transfer created: {} -> {}, amount={}", source.getId(), target.getId(), command.getAmount());
            return new TransferResult(expense, income);
        });
    }

    public Movement get(UUID id) {
        return movementStore.findById(id)
            .orElseThrow(() -> NotFoundException.of("Movement", id));
    }

    public List<Movement> findAll() {
        return movementStore.findAll();
    }

    public List<Movement> findPending() {
        return movementStore.findPending();
    }

    public List<Movement> findOrphaned() {
        return movementStore.findOrphaned();
    }

    /** Non-orphaned movements of an account. */
    public List<Movement> findByAccount(UUID accountId) {
        return movementStore.findByAccountId(accountId).stream()
            .filter(m -> !m.isOrphaned())
            .toList();
    }

    /** Non-orphaned movements of a pocket. */
    public List<Movement> findByPocket(UUID pocketId) {
        return movementStore.findByPocketId(pocketId).stream()
            .filter(m -> !m.isOrphaned())
            .toList();
    }

    /**
     * Non-orphaned movements whose displayed date falls in the given month.
     */
    public List<Movement> findByMonth(YearMonth month) {
        return movementStore.findAll().stream()
            .filter(m -> !m.isOrphaned())
            .filter(m -> YearMonth.from(m.getDisplayedDate()).equals(month))
            .toList();
    }

    /**
     * Non-orphaned movements grouped by displayed month, newest month first,
     * each group ordered by creation time.
     */
    public Map<YearMonth, List<Movement>> groupByMonth() {
        return movementStore.findAll().stream()
            .filter(m -> !m.isOrphaned())
            .sorted(Comparator.comparing(Movement::getCreatedAt))
            .collect(Collectors.groupingBy(
                m -> YearMonth.from(m.getDisplayedDate()),
                () -> new TreeMap<YearMonth, List<Movement>>(Comparator.reverseOrder()),
                Collectors.toList()));
    }

    private Movement guarded(String operation, Supplier<Movement> action) {
        long startTime = System.currentTimeMillis();
        try {
            Movement result = writeLock.execute(action);
            ledgerMetrics.recordMovement(operation, result.getType().name(), "success");
            return result;
        } catch (LedgerException e) {
            ledgerMetrics.recordMovement(operation, "unknown", e.getCode().name());
            log.warn("Movement {} rejected: {}", operation, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            ledgerMetrics.recordMovement(operation, "unknown", "error");
            log.error("Movement {} failed: {}", operation, e.getMessage());
            throw e;
        } finally {
            ledgerMetrics.recordLatency(operation, System.currentTimeMillis() - startTime);
            MDC.remove("movementId");
            MDC.remove("accountId");
        }
    }

    private void validateTargets(Movement movement) {
        if (movement.getType() == null) {
            throw new IllegalArgumentException("Movement type is required");
        }
        Account account = accountService.find(movement.getAccountId())
            .orElseThrow(() -> NotFoundException.of("Account", movement.getAccountId()));
        Pocket pocket = pocketService.find(movement.getPocketId())
            .orElseThrow(() -> NotFoundException.of("Pocket", movement.getPocketId()));
        if (!pocket.getAccountId().equals(account.getId())) {
            throw new IntegrityViolationException(String.format(
                "Pocket %s does not belong to account %s", pocket.getId(), account.getId()));
        }

        if (movement.getSubPocketId() != null) {
            SubPocket subPocket = subPocketService.find(movement.getSubPocketId())
                .orElseThrow(() -> NotFoundException.of("SubPocket", movement.getSubPocketId()));
            if (!subPocket.getPocketId().equals(pocket.getId())) {
                throw new IntegrityViolationException(String.format(
                    "Sub-pocket %s does not belong to pocket %s", subPocket.getId(), pocket.getId()));
            }
        }

        MovementType type = movement.getType();
        if (type.isFixed() && movement.getSubPocketId() == null) {
            throw new IntegrityViolationException(type + " movements require a sub-pocket");
        }
        if (!type.isFixed() && pocket.isFixed()) {
            throw new IntegrityViolationException(String.format(
                "%s movements cannot target the fixed pocket %s", type, pocket.getId()));
        }
        if (type.isInvestment() && !account.isInvestment()) {
            throw new IntegrityViolationException(String.format(
                "%s movements require an investment account; %s is %s", type, account.getId(), account.getType()));
        }
    }

    /**
     * Removes an effective movement's contribution. Pending and orphaned movements have
     * none, so there is nothing to undo.
     */
    private void reverse(Movement movement) {
        if (!movement.isEffective()) {
            log.debug("No reversal for movement {}: pending={}, orphaned={}",
                movement.getId(), movement.isPending(), movement.isOrphaned());
            return;
        }
        route(movement, movement.signedAmount().negate());
    }

    /**
     * Applies a signed delta to the movement's ledger target.
     * A target that no longer exists is skipped.
     */
    private void route(Movement movement, BigDecimal delta) {
        MovementType type = movement.getType();
        if (type.isInvestment()) {
            if (pocketService.applyDelta(movement.getPocketId(), delta).isEmpty()) {
                log.warn("Pocket {} no longer exists; skipping delta {}", movement.getPocketId(), delta);
            }
            accountService.adjustInvestment(movement.getAccountId(), type.investmentField(), delta);
        } else if (movement.getSubPocketId() != null) {
            if (subPocketService.applyDelta(movement.getSubPocketId(), delta).isEmpty()) {
                log.warn("Sub-pocket {} no longer exists; skipping delta {}", movement.getSubPocketId(), delta);
            }
        } else if (pocketService.applyDelta(movement.getPocketId(), delta).isEmpty()) {
            log.warn("Pocket {} no longer exists; skipping delta {}", movement.getPocketId(), delta);
        }
    }

    private void recomputeTouched(Movement old, Movement updated) {
        Set<UUID> accounts = new LinkedHashSet<>();
        if (!old.isOrphaned()) {
            accounts.add(old.getAccountId());
        }
        if (!updated.isOrphaned()) {
            accounts.add(updated.getAccountId());
        }
        accounts.forEach(recomputeService::recomputeIfPresent);
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidAmountException("Movement amount must be greater than zero");
        }
        if (amount.stripTrailingZeros().scale() > MAX_AMOUNT_SCALE) {
            throw new InvalidAmountException(String.format(
                "Movement amount %s has more than %d decimal places", amount.toPlainString(), MAX_AMOUNT_SCALE));
        }
    }

    private static String transferNote(String prefix, String notes) {
        return notes == null || notes.isBlank() ? prefix : prefix + ": " + notes;
    }
}
