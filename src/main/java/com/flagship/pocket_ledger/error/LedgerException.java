package com.flagship.pocket_ledger.error;

import lombok.Getter;

/**
 * Base type for every error raised by the ledger core.
 *
 * All ledger errors are unchecked and carry a {@link LedgerErrorCode} so callers can
 * react to the kind of failure without matching on exception classes.
 */
@Getter
public abstract class LedgerException extends RuntimeException {

    private final LedgerErrorCode code;

    protected LedgerException(LedgerErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected LedgerException(LedgerErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
