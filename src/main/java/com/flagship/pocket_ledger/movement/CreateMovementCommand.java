package com.flagship.pocket_ledger.movement;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Input for {@link MovementService#create}. {@code displayedDate} defaults to today.
 */
@Value
@Builder
public class CreateMovementCommand {
    MovementType type;
    UUID accountId;
    UUID pocketId;
    UUID subPocketId;
    BigDecimal amount;
    String notes;
    LocalDate displayedDate;
    boolean pending;
}
