package com.flagship.pocket_ledger.error;

/**
 * Structured error kinds raised by ledger operations.
 */
public enum LedgerErrorCode {
    /** Referenced account, pocket, sub-pocket or movement does not exist. */
    NOT_FOUND,
    /** Zero, negative or missing amount (or target/periodicity). */
    INVALID_AMOUNT,
    /** Parent mismatch, duplicate name, second fixed pocket, deleting a parent with children. */
    INTEGRITY_VIOLATION,
    /** Operation not allowed in the current lifecycle state. */
    INVALID_STATE,
    /** The backing store failed. Callers must reload authoritative state. */
    PERSISTENCE_ERROR
}
