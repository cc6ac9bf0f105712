package com.flagship.pocket_ledger.account;

public enum AccountType {
    /** Balance is the sum of its pockets. */
    NORMAL,
    /** Balance is share count times market price. */
    INVESTMENT
}
