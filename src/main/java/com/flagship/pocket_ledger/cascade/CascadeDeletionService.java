package com.flagship.pocket_ledger.cascade;

import com.flagship.pocket_ledger.account.Account;
import com.flagship.pocket_ledger.account.AccountService;
import com.flagship.pocket_ledger.balance.BalanceRecomputeService;
import com.flagship.pocket_ledger.error.IntegrityViolationException;
import com.flagship.pocket_ledger.movement.LedgerWriteLock;
import com.flagship.pocket_ledger.movement.Movement;
import com.flagship.pocket_ledger.movement.MovementStore;
import com.flagship.pocket_ledger.movement.OrphanReason;
import com.flagship.pocket_ledger.observability.LedgerMetrics;
import com.flagship.pocket_ledger.pocket.Pocket;
import com.flagship.pocket_ledger.pocket.PocketService;
import com.flagship.pocket_ledger.subpocket.SubPocket;
import com.flagship.pocket_ledger.subpocket.SubPocketService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Deletes parents together with everything below them.
 *
 * Movements are handled first: by default they are kept and marked orphaned with a
 * snapshot of their parent names; with {@code hardDeleteMovements} they are removed.
 * Then sub-pockets, pockets and finally the parent itself are deleted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CascadeDeletionService {

    private final AccountService accountService;
    private final PocketService pocketService;
    private final SubPocketService subPocketService;
    private final MovementStore movementStore;
    private final BalanceRecomputeService recomputeService;
    private final LedgerWriteLock writeLock;
    private final LedgerMetrics ledgerMetrics;

    public CascadeDeleteResult deleteAccount(UUID accountId) {
        return deleteAccount(accountId, false);
    }

    /**
     * Deletes an account with its pockets, sub-pockets and (orphaned or deleted) movements.
     */
    public CascadeDeleteResult deleteAccount(UUID accountId, boolean hardDeleteMovements) {
        return writeLock.execute(() -> {
            MDC.put("accountId", accountId.toString());
            try {
                Account account = accountService.get(accountId);
                List<Pocket> pockets = accountService.pocketsOf(accountId);

                Map<UUID, String> pocketNames = new HashMap<>();
                Map<UUID, String> subPocketNames = new HashMap<>();
                List<SubPocket> subPockets = new ArrayList<>();
                for (Pocket pocket : pockets) {
                    pocketNames.put(pocket.getId(), pocket.getName());
                    for (SubPocket subPocket : pocketService.subPocketsOf(pocket.getId())) {
                        subPocketNames.put(subPocket.getId(), subPocket.getName());
                        subPockets.add(subPocket);
                    }
                }

                Map<UUID, Movement> movements = new LinkedHashMap<>();
                movementStore.findByAccountId(accountId).forEach(m -> movements.put(m.getId(), m));
                for (Pocket pocket : pockets) {
                    movementStore.findByPocketId(pocket.getId()).forEach(m -> movements.put(m.getId(), m));
                }

                int movementCount = 0;
                for (Movement movement : movements.values()) {
                    if (hardDeleteMovements) {
                        movementStore.delete(movement.getId());
                        movementCount++;
                    } else if (!movement.isOrphaned()) {
                        movementStore.update(movement.orphan(OrphanReason.ACCOUNT, account.getName(),
                            account.getCurrency(), pocketNames.get(movement.getPocketId()),
                            subPocketNames.get(movement.getSubPocketId())));
                        movementCount++;
                    }
                }

                for (SubPocket subPocket : subPockets) {
                    subPocketService.delete(subPocket.getId());
                }
                for (Pocket pocket : pockets) {
                    pocketService.delete(pocket.getId());
                }
                accountService.delete(accountId);

                recordMovements(movementCount, hardDeleteMovements);
                ledgerMetrics.recordCascadeDelete("account", hardDeleteMovements);
                log.info("Account deleted with cascade: name={}, pockets={}, subPockets={}, movements={}, hard={}",
                    account.getName(), pockets.size(), subPockets.size(), movementCount, hardDeleteMovements);
                return new CascadeDeleteResult(account.getName(), pockets.size(), subPockets.size(), movementCount);
            } finally {
                MDC.remove("accountId");
            }
        });
    }

    public CascadeDeleteResult deletePocket(UUID pocketId) {
        return deletePocket(pocketId, false);
    }

    /**
     * Deletes a pocket and orphans (or deletes) its movements.
     *
     * @throws IntegrityViolationException if the pocket is FIXED and still has sub-pockets
     */
    public CascadeDeleteResult deletePocket(UUID pocketId, boolean hardDeleteMovements) {
        return writeLock.execute(() -> {
            Pocket pocket = pocketService.get(pocketId);
            MDC.put("accountId", pocket.getAccountId().toString());
            try {
                List<SubPocket> subPockets = pocketService.subPocketsOf(pocketId);
                if (pocket.isFixed() && !subPockets.isEmpty()) {
                    throw new IntegrityViolationException(String.format(
                        "Cannot delete fixed pocket \"%s\" because it has %d sub-pocket(s). Delete them first.",
                        pocket.getName(), subPockets.size()));
                }
                Account account = accountService.get(pocket.getAccountId());

                int movementCount = 0;
                for (Movement movement : movementStore.findByPocketId(pocketId)) {
                    if (hardDeleteMovements) {
                        movementStore.delete(movement.getId());
                        movementCount++;
                    } else if (!movement.isOrphaned()) {
                        movementStore.update(movement.orphan(OrphanReason.POCKET, account.getName(),
                            account.getCurrency(), pocket.getName(), null));
                        movementCount++;
                    }
                }

                pocketService.delete(pocketId);
                recomputeService.recompute(account.getId());

                recordMovements(movementCount, hardDeleteMovements);
                ledgerMetrics.recordCascadeDelete("pocket", hardDeleteMovements);
                log.info("Pocket deleted: name={}, movements={}, hard={}",
                    pocket.getName(), movementCount, hardDeleteMovements);
                return new CascadeDeleteResult(pocket.getName(), 1, 0, movementCount);
            } finally {
                MDC.remove("accountId");
            }
        });
    }

    /**
     * Deletes a sub-pocket and orphans its movements.
     */
    public CascadeDeleteResult deleteSubPocket(UUID subPocketId) {
        return writeLock.execute(() -> {
            SubPocket subPocket = subPocketService.get(subPocketId);
            Pocket pocket = pocketService.get(subPocket.getPocketId());
            Account account = accountService.get(pocket.getAccountId());

            int movementCount = 0;
            for (Movement movement : movementStore.findBySubPocketId(subPocketId)) {
                if (!movement.isOrphaned()) {
                    movementStore.update(movement.orphan(OrphanReason.SUB_POCKET, account.getName(),
                        account.getCurrency(), pocket.getName(), subPocket.getName()));
                    movementCount++;
                }
            }

            subPocketService.delete(subPocketId);
            recomputeService.recompute(account.getId());

            recordMovements(movementCount, false);
            ledgerMetrics.recordCascadeDelete("sub_pocket", false);
            log.info("Sub-pocket deleted: name={}, orphanedMovements={}", subPocket.getName(), movementCount);
            return new CascadeDeleteResult(subPocket.getName(), 0, 1, movementCount);
        });
    }

    private void recordMovements(int count, boolean hardDeleted) {
        if (!hardDeleted) {
            ledgerMetrics.recordOrphaned(count);
        }
    }
}
