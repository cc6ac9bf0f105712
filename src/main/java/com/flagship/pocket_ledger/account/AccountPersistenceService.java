package com.flagship.pocket_ledger.account;

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
 * JPA-backed {@link AccountStore}.
 *
 * Bridges the domain layer ({@link Account}) and the persistence layer ({@link AccountEntity}).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountPersistenceService implements AccountStore {

    private final AccountRepository accountRepository;

    @Override
    @Transactional(readOnly = true)
    public List<Account> findAll() {
        try {
            return accountRepository.findAllByOrderByDisplayOrderAscCreatedAtAsc().stream()
                .map(AccountEntity::toDomain)
                .toList();
        } catch (DataAccessException e) {
            throw failure("load accounts", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> findById(UUID id) {
        try {
            return accountRepository.findById(id).map(AccountEntity::toDomain);
        } catch (DataAccessException e) {
            throw failure("load account " + id, e);
        }
    }

    @Override
    @Transactional
    public Account insert(Account account) {
        try {
            AccountEntity saved = accountRepository.saveAndFlush(AccountEntity.fromDomain(account));
            log.debug("Inserted account {}", saved.getId());
            return saved.toDomain();
        } catch (DataAccessException e) {
            throw failure("insert account " + account.getId(), e);
        }
    }

    @Override
    @Transactional
    public Account update(Account account) {
        try {
            AccountEntity existing = accountRepository.findById(account.getId())
                .orElseThrow(() -> NotFoundException.of("Account", account.getId()));
            existing.updateFromDomain(account);
            AccountEntity saved = accountRepository.saveAndFlush(existing);
            log.debug("Updated account {}", saved.getId());
            return saved.toDomain();
        } catch (DataAccessException e) {
            throw failure("update account " + account.getId(), e);
        }
    }

    @Override
    @Transactional
    public void delete(UUID id) {
        try {
            accountRepository.deleteById(id);
            accountRepository.flush();
            log.debug("Deleted account {}", id);
        } catch (DataAccessException e) {
            throw failure("delete account " + id, e);
        }
    }

    private PersistenceException failure(String operation, DataAccessException e) {
        log.error("Account store failed to {}: {}", operation, e.getMessage());
        return new PersistenceException("Failed to " + operation, e);
    }
}
