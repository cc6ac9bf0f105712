package com.flagship.pocket_ledger.support;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Scale-insensitive BigDecimal assertions.
 */
public final class Amounts {

    private Amounts() {
    }

    public static void assertAmount(String expected, BigDecimal actual) {
        assertNotNull(actual, "amount was null, expected " + expected);
        assertTrue(new BigDecimal(expected).compareTo(actual) == 0,
            () -> "expected " + expected + " but was " + actual.toPlainString());
    }
}
