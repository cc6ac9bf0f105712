package com.flagship.pocket_ledger.support;

import com.flagship.pocket_ledger.account.Account;
import com.flagship.pocket_ledger.account.AccountStore;

public class InMemoryAccountStore extends InMemoryEntityStore<Account> implements AccountStore {

    public InMemoryAccountStore() {
        super("Account", Account::getId);
    }
}
