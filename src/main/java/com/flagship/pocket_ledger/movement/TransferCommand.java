package com.flagship.pocket_ledger.movement;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class TransferCommand {
    UUID sourcePocketId;
    UUID targetPocketId;
    BigDecimal amount;
    String notes;
    LocalDate displayedDate;
}
