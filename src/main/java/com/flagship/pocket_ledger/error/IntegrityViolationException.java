package com.flagship.pocket_ledger.error;

public class IntegrityViolationException extends LedgerException {

    public IntegrityViolationException(String message) {
        super(LedgerErrorCode.INTEGRITY_VIOLATION, message);
    }
}
