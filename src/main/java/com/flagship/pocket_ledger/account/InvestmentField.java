package com.flagship.pocket_ledger.account;

/**
 * Accumulated fields of an investment account and the pocket that mirrors each one.
 *
 * When the mirroring pocket exists the field is copied from its balance; otherwise the
 * field accumulates movement deltas directly.
 */
public enum InvestmentField {
    INVESTED_AMOUNT("Invested Money"),
    SHARE_COUNT("Shares");

    private final String pocketName;

    InvestmentField(String pocketName) {
        this.pocketName = pocketName;
    }

    public String pocketName() {
        return pocketName;
    }
}
