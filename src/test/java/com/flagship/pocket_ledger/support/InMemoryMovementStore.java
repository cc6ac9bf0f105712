package com.flagship.pocket_ledger.support;

import com.flagship.pocket_ledger.movement.Movement;
import com.flagship.pocket_ledger.movement.MovementStore;

import java.util.List;
import java.util.UUID;

public class InMemoryMovementStore extends InMemoryEntityStore<Movement> implements MovementStore {

    public InMemoryMovementStore() {
        super("Movement", Movement::getId);
    }

    @Override
    public List<Movement> findByAccountId(UUID accountId) {
        return where(m -> m.getAccountId().equals(accountId));
    }

    @Override
    public List<Movement> findByPocketId(UUID pocketId) {
        return where(m -> m.getPocketId().equals(pocketId));
    }

    @Override
    public List<Movement> findBySubPocketId(UUID subPocketId) {
        return where(m -> subPocketId.equals(m.getSubPocketId()));
    }

    @Override
    public List<Movement> findPending() {
        return where(m -> m.isPending() && !m.isOrphaned());
    }

    @Override
    public List<Movement> findOrphaned() {
        return where(Movement::isOrphaned);
    }

    @Override
    public long countPending() {
        return findPending().size();
    }

    @Override
    public long countOrphaned() {
        return findOrphaned().size();
    }
}
