package com.flagship.pocket_ledger.movement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface MovementRepository extends JpaRepository<MovementEntity, UUID> {

    List<MovementEntity> findAllByOrderByCreatedAtAsc();

    List<MovementEntity> findByAccountIdOrderByCreatedAtAsc(UUID accountId);

    List<MovementEntity> findByPocketIdOrderByCreatedAtAsc(UUID pocketId);

    List<MovementEntity> findBySubPocketIdOrderByCreatedAtAsc(UUID subPocketId);

    List<MovementEntity> findByPendingTrueAndOrphanedFalseOrderByCreatedAtAsc();

    List<MovementEntity> findByOrphanedTrueOrderByCreatedAtAsc();

    long countByPendingTrueAndOrphanedFalse();

    long countByOrphanedTrue();
}
