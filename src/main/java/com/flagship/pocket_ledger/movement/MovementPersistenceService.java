package com.flagship.pocket_ledger.movement;

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
import java.util.function.Supplier;

/**
 * JPA-backed {@link MovementStore}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MovementPersistenceService implements MovementStore {

    private final MovementRepository movementRepository;

    @Override
    @Transactional(readOnly = true)
    public List<Movement> findAll() {
        return load("load movements", movementRepository::findAllByOrderByCreatedAtAsc);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Movement> findById(UUID id) {
        try {
            return movementRepository.findById(id).map(MovementEntity::toDomain);
        } catch (DataAccessException e) {
            throw failure("load movement " + id, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Movement> findByAccountId(UUID accountId) {
        return load("load movements of account " + accountId,
            () -> movementRepository.findByAccountIdOrderByCreatedAtAsc(accountId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Movement> findByPocketId(UUID pocketId) {
        return load("load movements of pocket " + pocketId,
            () -> movementRepository.findByPocketIdOrderByCreatedAtAsc(pocketId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Movement> findBySubPocketId(UUID subPocketId) {
        return load("load movements of sub-pocket " + subPocketId,
            () -> movementRepository.findBySubPocketIdOrderByCreatedAtAsc(subPocketId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Movement> findPending() {
        return load("load pending movements",
            movementRepository::findByPendingTrueAndOrphanedFalseOrderByCreatedAtAsc);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Movement> findOrphaned() {
        return load("load orphaned movements", movementRepository::findByOrphanedTrueOrderByCreatedAtAsc);
    }

    @Override
    @Transactional(readOnly = true)
    public long countPending() {
        try {
            return movementRepository.countByPendingTrueAndOrphanedFalse();
        } catch (DataAccessException e) {
            throw failure("count pending movements", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long countOrphaned() {
        try {
            return movementRepository.countByOrphanedTrue();
        } catch (DataAccessException e) {
            throw failure("count orphaned movements", e);
        }
    }

    @Override
    @Transactional
    public Movement insert(Movement movement) {
        try {
            MovementEntity saved = movementRepository.saveAndFlush(MovementEntity.fromDomain(movement));
            log.debug("Inserted movement {} ({})", saved.getId(), saved.getType());
            return saved.toDomain();
        } catch (DataAccessException e) {
            throw failure("insert movement " + movement.getId(), e);
        }
    }

    @Override
    @Transactional
    public Movement update(Movement movement) {
        try {
            MovementEntity existing = movementRepository.findById(movement.getId())
                .orElseThrow(() -> NotFoundException.of("Movement", movement.getId()));
            existing.updateFromDomain(movement);
            MovementEntity saved = movementRepository.saveAndFlush(existing);
            log.debug("Updated movement {}", saved.getId());
            return saved.toDomain();
        } catch (DataAccessException e) {
            throw failure("update movement " + movement.getId(), e);
        }
    }

    @Override
    @Transactional
    public void delete(UUID id) {
        try {
            movementRepository.deleteById(id);
            movementRepository.flush();
            log.debug("Deleted movement {}", id);
        } catch (DataAccessException e) {
            throw failure("delete movement " + id, e);
        }
    }

    private List<Movement> load(String operation, Supplier<List<MovementEntity>> query) {
        try {
            return query.get().stream().map(MovementEntity::toDomain).toList();
        } catch (DataAccessException e) {
            throw failure(operation, e);
        }
    }

    private PersistenceException failure(String operation, DataAccessException e) {
        log.error("Movement store failed to {}: {}", operation, e.getMessage());
        return new PersistenceException("Failed to " + operation, e);
    }
}
