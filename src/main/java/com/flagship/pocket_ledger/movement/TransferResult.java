package com.flagship.pocket_ledger.movement;

import lombok.Value;

/**
 * The two legs written by a transfer.
 */
@Value
public class TransferResult {
    Movement expense;
    Movement income;
}
