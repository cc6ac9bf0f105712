package com.flagship.pocket_ledger.sync;

import com.flagship.pocket_ledger.account.AccountStore;
import com.flagship.pocket_ledger.movement.MovementStore;
import com.flagship.pocket_ledger.pocket.PocketStore;
import com.flagship.pocket_ledger.subpocket.SubPocketStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Reads the authoritative ledger state from the entity stores.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerSnapshotLoader {

    private final AccountStore accountStore;
    private final PocketStore pocketStore;
    private final SubPocketStore subPocketStore;
    private final MovementStore movementStore;
    private final Clock clock;

    public LedgerSnapshot load() {
        LedgerSnapshot snapshot = new LedgerSnapshot(
            accountStore.findAll(),
            pocketStore.findAll(),
            subPocketStore.findAll(),
            movementStore.findAll(),
            clock.instant());
        log.debug("Loaded ledger snapshot: accounts={}, pockets={}, subPockets={}, movements={}",
            snapshot.getAccounts().size(), snapshot.getPockets().size(),
            snapshot.getSubPockets().size(), snapshot.getMovements().size());
        return snapshot;
    }
}
