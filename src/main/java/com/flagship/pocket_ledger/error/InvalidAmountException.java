package com.flagship.pocket_ledger.error;

public class InvalidAmountException extends LedgerException {

    public InvalidAmountException(String message) {
        super(LedgerErrorCode.INVALID_AMOUNT, message);
    }
}
