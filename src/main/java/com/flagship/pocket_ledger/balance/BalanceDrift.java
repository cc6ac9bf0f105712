package com.flagship.pocket_ledger.balance;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A stored balance that differs from its derived value.
 */
@Value
public class BalanceDrift {
    String entity;
    UUID id;
    BigDecimal stored;
    BigDecimal derived;
}
