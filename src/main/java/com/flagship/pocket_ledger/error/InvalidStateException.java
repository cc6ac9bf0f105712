package com.flagship.pocket_ledger.error;

public class InvalidStateException extends LedgerException {

    public InvalidStateException(String message) {
        super(LedgerErrorCode.INVALID_STATE, message);
    }
}
