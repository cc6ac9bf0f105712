package com.flagship.pocket_ledger.subpocket;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SubPocketRepository extends JpaRepository<SubPocketEntity, UUID> {

    List<SubPocketEntity> findByPocketIdOrderByCreatedAtAsc(UUID pocketId);
}
