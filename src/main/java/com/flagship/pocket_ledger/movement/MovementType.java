package com.flagship.pocket_ledger.movement;

import com.flagship.pocket_ledger.account.InvestmentField;

import java.math.BigDecimal;

/**
 * Movement kinds, each with a fixed direction.
 */
public enum MovementType {
    INCOME_NORMAL(true),
    EXPENSE_NORMAL(false),
    INCOME_FIXED(true),
    EXPENSE_FIXED(false),
    INVESTMENT_DEPOSIT(true),
    INVESTMENT_SHARES(true);

    private final boolean increment;

    MovementType(boolean increment) {
        this.increment = increment;
    }

    public boolean isIncrement() {
        return increment;
    }

    public boolean isFixed() {
        return this == INCOME_FIXED || this == EXPENSE_FIXED;
    }

    public boolean isInvestment() {
        return this == INVESTMENT_DEPOSIT || this == INVESTMENT_SHARES;
    }

    /**
     * The amount with this type's sign applied.
     */
    public BigDecimal signed(BigDecimal amount) {
        return increment ? amount : amount.negate();
    }

    /**
     * The account field an investment movement accumulates into.
     *
     * @throws IllegalStateException for non-investment types
     */
    public InvestmentField investmentField() {
        return switch (this) {
            case INVESTMENT_DEPOSIT -> InvestmentField.INVESTED_AMOUNT;
            case INVESTMENT_SHARES -> InvestmentField.SHARE_COUNT;
            default -> throw new IllegalStateException(name() + " is not an investment movement");
        };
    }
}
