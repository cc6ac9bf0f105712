package com.flagship.pocket_ledger.cascade;

import lombok.Value;

/**
 * Counts of what a cascade delete removed or orphaned.
 */
@Value
public class CascadeDeleteResult {
    String name;
    int pockets;
    int subPockets;
    int movements;
}
