package com.flagship.pocket_ledger.pocket;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entity store for pockets.
 */
public interface PocketStore {

    List<Pocket> findAll();

    Optional<Pocket> findById(UUID id);

    List<Pocket> findByAccountId(UUID accountId);

    Pocket insert(Pocket pocket);

    Pocket update(Pocket pocket);

    void delete(UUID id);
}
