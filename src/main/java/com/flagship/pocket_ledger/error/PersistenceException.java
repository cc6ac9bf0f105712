package com.flagship.pocket_ledger.error;

/**
 * Raised when a store operation fails.
 *
 * Local views may be ahead of the store at this point; the caller is expected to
 * discard them and reload authoritative state.
 */
public class PersistenceException extends LedgerException {

    public PersistenceException(String message, Throwable cause) {
        super(LedgerErrorCode.PERSISTENCE_ERROR, message, cause);
    }
}
