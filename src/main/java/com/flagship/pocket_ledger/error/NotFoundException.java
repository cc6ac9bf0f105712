package com.flagship.pocket_ledger.error;

import java.util.UUID;

public class NotFoundException extends LedgerException {

    public NotFoundException(String message) {
        super(LedgerErrorCode.NOT_FOUND, message);
    }

    public static NotFoundException of(String entity, UUID id) {
        return new NotFoundException(String.format("%s not found: %s", entity, id));
    }
}
