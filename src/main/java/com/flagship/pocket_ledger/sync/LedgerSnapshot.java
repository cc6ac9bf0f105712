package com.flagship.pocket_ledger.sync;

import com.flagship.pocket_ledger.account.Account;
import com.flagship.pocket_ledger.movement.Movement;
import com.flagship.pocket_ledger.pocket.Pocket;
import com.flagship.pocket_ledger.subpocket.SubPocket;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable client-side copy of the ledger.
 */
@Value
public class LedgerSnapshot {
    List<Account> accounts;
    List<Pocket> pockets;
    List<SubPocket> subPockets;
    List<Movement> movements;
    Instant loadedAt;

    public Optional<Account> account(UUID id) {
        return accounts.stream().filter(a -> a.getId().equals(id)).findFirst();
    }

    public Optional<Pocket> pocket(UUID id) {
        return pockets.stream().filter(p -> p.getId().equals(id)).findFirst();
    }

    public Optional<SubPocket> subPocket(UUID id) {
        return subPockets.stream().filter(s -> s.getId().equals(id)).findFirst();
    }

    public LedgerSnapshot withAccounts(List<Account> newAccounts) {
        return new LedgerSnapshot(List.copyOf(newAccounts), pockets, subPockets, movements, loadedAt);
    }

    public LedgerSnapshot withPockets(List<Pocket> newPockets) {
        return new LedgerSnapshot(accounts, List.copyOf(newPockets), subPockets, movements, loadedAt);
    }

    public LedgerSnapshot withSubPockets(List<SubPocket> newSubPockets) {
        return new LedgerSnapshot(accounts, pockets, List.copyOf(newSubPockets), movements, loadedAt);
    }

    public LedgerSnapshot withMovements(List<Movement> newMovements) {
        return new LedgerSnapshot(accounts, pockets, subPockets, List.copyOf(newMovements), loadedAt);
    }
}
