package com.flagship.pocket_ledger.subpocket;

import com.flagship.pocket_ledger.error.NotFoundException;
import com.flagship.pocket_ledger.error.PersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA-backed {@link SubPocketStore}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubPocketPersistenceService implements SubPocketStore {

    private final SubPocketRepository subPocketRepository;

    @Override
    @Transactional(readOnly = true)
    public List<SubPocket> findAll() {
        try {
            return subPocketRepository.findAll().stream().map(SubPocketEntity::toDomain).toList();
        } catch (DataAccessException e) {
            throw failure("load sub-pockets", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SubPocket> findById(UUID id) {
        try {
            return subPocketRepository.findById(id).map(SubPocketEntity::toDomain);
        } catch (DataAccessException e) {
            throw failure("load sub-pocket " + id, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<SubPocket> findByPocketId(UUID pocketId) {
        try {
            return subPocketRepository.findByPocketIdOrderByCreatedAtAsc(pocketId).stream()
                .map(SubPocketEntity::toDomain)
                .toList();
        } catch (DataAccessException e) {
            throw failure("load sub-pockets of pocket " + pocketId, e);
        }
    }

    @Override
    @Transactional
    public SubPocket insert(SubPocket subPocket) {
        try {
            SubPocketEntity saved = subPocketRepository.saveAndFlush(SubPocketEntity.fromDomain(subPocket));
            log.debug("Inserted sub-pocket {} in pocket {}", saved.getId(), saved.getPocketId());
            return saved.toDomain();
        } catch (DataAccessException e) {
            throw failure("insert sub-pocket " + subPocket.getId(), e);
        }
    }

    @Override
    @Transactional
    public SubPocket update(SubPocket subPocket) {
        try {
            SubPocketEntity existing = subPocketRepository.findById(subPocket.getId())
                .orElseThrow(() -> NotFoundException.of("SubPocket", subPocket.getId()));
            existing.updateFromDomain(subPocket);
            SubPocketEntity saved = subPocketRepository.saveAndFlush(existing);
            log.debug("Updated sub-pocket {}", saved.getId());
            return saved.toDomain();
        } catch (DataAccessException e) {
            throw failure("update sub-pocket " + subPocket.getId(), e);
        }
    }

    @Override
    @Transactional
    public void delete(UUID id) {
        try {
            subPocketRepository.deleteById(id);
            subPocketRepository.flush();
            log.debug("Deleted sub-pocket {}", id);
        } catch (DataAccessException e) {
            throw failure("delete sub-pocket " + id, e);
        }
    }

    private PersistenceException failure(String operation, DataAccessException e) {
        log.error("Sub-pocket store failed to {}: {}", operation, e.getMessage());
        return new PersistenceException("Failed to " + operation, e);
    }
}
