package com.flagship.pocket_ledger.cascade;

import lombok.Value;

@Value
public class RestoreResult {
    int restored;
    int failed;
}
