package com.flagship.pocket_ledger.pocket;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PocketRepository extends JpaRepository<PocketEntity, UUID> {

    List<PocketEntity> findByAccountIdOrderByCreatedAtAsc(UUID accountId);

    List<PocketEntity> findByType(PocketType type);
}
