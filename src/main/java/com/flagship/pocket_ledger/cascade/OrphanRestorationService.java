package com.flagship.pocket_ledger.cascade;

import com.flagship.pocket_ledger.account.Account;
import com.flagship.pocket_ledger.account.AccountService;
import com.flagship.pocket_ledger.error.LedgerException;
import com.flagship.pocket_ledger.movement.Movement;
import com.flagship.pocket_ledger.movement.MovementService;
import com.flagship.pocket_ledger.movement.MovementUpdate;
import com.flagship.pocket_ledger.observability.LedgerMetrics;
import com.flagship.pocket_ledger.pocket.Pocket;
import com.flagship.pocket_ledger.pocket.PocketService;
import com.flagship.pocket_ledger.subpocket.SubPocket;
import com.flagship.pocket_ledger.subpocket.SubPocketService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Re-homes orphaned movements onto live parents with matching names.
 *
 * Matching uses the orphan snapshot: account by exact name and currency, pocket by name
 * (case-insensitive) within that account, and sub-pocket by name when the movement had one.
 * Each movement is restored through {@link MovementService#update} in its own write, so
 * one unmatched or invalid movement does not block the others.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrphanRestorationService {

    private final MovementService movementService;
    private final AccountService accountService;
    private final PocketService pocketService;
    private final SubPocketService subPocketService;
    private final LedgerMetrics ledgerMetrics;

    public RestoreResult restoreOrphans() {
        int restored = 0;
        int failed = 0;

        for (Movement orphan : movementService.findOrphaned()) {
            Optional<MovementUpdate> target = matchParents(orphan);
            if (target.isEmpty()) {
                log.warn("No matching parents for orphaned movement {} (account=\"{}\" {}, pocket=\"{}\")",
                    orphan.getId(), orphan.getOrphanedAccountName(), orphan.getOrphanedAccountCurrency(),
                    orphan.getOrphanedPocketName());
                failed++;
                continue;
            }
            try {
                movementService.update(orphan.getId(), target.get());
                restored++;
            } catch (LedgerException e) {
                log.warn("Could not restore orphaned movement {}: {}", orphan.getId(), e.getMessage());
                failed++;
            }
        }

        ledgerMetrics.recordRestoration(restored, failed);
        log.info("Orphan restoration finished: restored={}, failed={}", restored, failed);
        return new RestoreResult(restored, failed);
    }

    private Optional<MovementUpdate> matchParents(Movement orphan) {
        if (orphan.getOrphanedAccountName() == null || orphan.getOrphanedPocketName() == null) {
            return Optional.empty();
        }
        Optional<Account> account = accountService.findAll().stream()
            .filter(a -> a.getName().equals(orphan.getOrphanedAccountName())
                && a.getCurrency() == orphan.getOrphanedAccountCurrency())
            .findFirst();
        if (account.isEmpty()) {
            return Optional.empty();
        }
        Optional<Pocket> pocket = pocketService.findByAccount(account.get().getId()).stream()
            .filter(p -> p.getName().equalsIgnoreCase(orphan.getOrphanedPocketName()))
            .findFirst();
        if (pocket.isEmpty()) {
            return Optional.empty();
        }

        MovementUpdate.MovementUpdateBuilder update = MovementUpdate.builder()
            .accountId(account.get().getId())
            .pocketId(pocket.get().getId());
        if (orphan.getSubPocketId() != null) {
            if (orphan.getOrphanedSubPocketName() == null) {
                return Optional.empty();
            }
            Optional<SubPocket> subPocket = subPocketService.findByPocket(pocket.get().getId()).stream()
                .filter(s -> s.getName().equalsIgnoreCase(orphan.getOrphanedSubPocketName()))
                .findFirst();
            if (subPocket.isEmpty()) {
                return Optional.empty();
            }
            update.subPocketId(subPocket.get().getId());
        }
        return Optional.of(update.build());
    }
}
