package com.flagship.pocket_ledger.pocket;

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
 * JPA-backed {@link PocketStore}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PocketPersistenceService implements PocketStore {

    private final PocketRepository pocketRepository;

    @Override
    @Transactional(readOnly = true)
    public List<Pocket> findAll() {
        try {
            return pocketRepository.findAll().stream().map(PocketEntity::toDomain).toList();
        } catch (DataAccessException e) {
            throw failure("load pockets", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Pocket> findById(UUID id) {
        try {
            return pocketRepository.findById(id).map(PocketEntity::toDomain);
        } catch (DataAccessException e) {
            throw failure("load pocket " + id, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Pocket> findByAccountId(UUID accountId) {
        try {
            return pocketRepository.findByAccountIdOrderByCreatedAtAsc(accountId).stream()
                .map(PocketEntity::toDomain)
                .toList();
        } catch (DataAccessException e) {
            throw failure("load pockets of account " + accountId, e);
        }
    }

    @Override
    @Transactional
    public Pocket insert(Pocket pocket) {
        try {
            PocketEntity saved = pocketRepository.saveAndFlush(PocketEntity.fromDomain(pocket));
            log.debug("Inserted pocket {} in account {}", saved.getId(), saved.getAccountId());
            return saved.toDomain();
        } catch (DataAccessException e) {
            throw failure("insert pocket " + pocket.getId(), e);
        }
    }

    @Override
    @Transactional
    public Pocket update(Pocket pocket) {
        try {
            PocketEntity existing = pocketRepository.findById(pocket.getId())
                .orElseThrow(() -> NotFoundException.of("Pocket", pocket.getId()));
            existing.updateFromDomain(pocket);
            PocketEntity saved = pocketRepository.saveAndFlush(existing);
            log.debug("Updated pocket {}", saved.getId());
            return saved.toDomain();
        } catch (DataAccessException e) {
            throw failure("update pocket " + pocket.getId(), e);
        }
    }

    @Override
    @Transactional
    public void delete(UUID id) {
        try {
            pocketRepository.deleteById(id);
            pocketRepository.flush();
            log.debug("Deleted pocket {}", id);
        } catch (DataAccessException e) {
            throw failure("delete pocket " + id, e);
        }
    }

    private PersistenceException failure(String operation, DataAccessException e) {
        log.error("Pocket store failed to {}: {}", operation, e.getMessage());
        return new PersistenceException("Failed to " + operation, e);
    }
}
