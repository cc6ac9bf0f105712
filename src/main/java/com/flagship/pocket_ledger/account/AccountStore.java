package com.flagship.pocket_ledger.account;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entity store for accounts.
 *
 * Implementations surface every backend failure as a
 * {@link com.flagship.pocket_ledger.error.PersistenceException}.
 */
public interface AccountStore {

    List<Account> findAll();

    Optional<Account> findById(UUID id);

    Account insert(Account account);

    Account update(Account account);

    void delete(UUID id);
}
