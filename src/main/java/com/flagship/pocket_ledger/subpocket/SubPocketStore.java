package com.flagship.pocket_ledger.subpocket;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entity store for sub-pockets.
 */
public interface SubPocketStore {

    List<SubPocket> findAll();

    Optional<SubPocket> findById(UUID id);

    List<SubPocket> findByPocketId(UUID pocketId);

    SubPocket insert(SubPocket subPocket);

    SubPocket update(SubPocket subPocket);

    void delete(UUID id);
}
