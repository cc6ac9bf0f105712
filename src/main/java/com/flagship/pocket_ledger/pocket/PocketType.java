package com.flagship.pocket_ledger.pocket;

public enum PocketType {
    /** Balance accumulates directly from movements. */
    NORMAL,
    /** Balance is the sum of its sub-pockets. At most one exists. */
    FIXED
}
