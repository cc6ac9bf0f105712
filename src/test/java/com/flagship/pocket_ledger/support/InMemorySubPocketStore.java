package com.flagship.pocket_ledger.support;

import com.flagship.pocket_ledger.subpocket.SubPocket;
import com.flagship.pocket_ledger.subpocket.SubPocketStore;

import java.util.List;
import java.util.UUID;

public class InMemorySubPocketStore extends InMemoryEntityStore<SubPocket> implements SubPocketStore {

    public InMemorySubPocketStore() {
        super("SubPocket", SubPocket::getId);
    }

    @Override
    public List<SubPocket> findByPocketId(UUID pocketId) {
        return where(s -> s.getPocketId().equals(pocketId));
    }
}
