package com.flagship.pocket_ledger.movement;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entity store for movements. Lists are ordered by creation time.
 */
public interface MovementStore {

    List<Movement> findAll();

    Optional<Movement> findById(UUID id);

    List<Movement> findByAccountId(UUID accountId);

    List<Movement> findByPocketId(UUID pocketId);

    List<Movement> findBySubPocketId(UUID subPocketId);

    /** Pending movements that are not orphaned. */
    List<Movement> findPending();

    List<Movement> findOrphaned();

    long countPending();

    long countOrphaned();

    Movement insert(Movement movement);

    Movement update(Movement movement);

    void delete(UUID id);
}
