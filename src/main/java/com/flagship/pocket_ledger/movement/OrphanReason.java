package com.flagship.pocket_ledger.movement;

/**
 * Which parent deletion left a movement orphaned.
 */
public enum OrphanReason {
    ACCOUNT,
    POCKET,
    SUB_POCKET
}
