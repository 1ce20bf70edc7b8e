package com.shop.payments.gateway;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversion between main currency units and the provider's smallest unit (kobo, pesewas,
 * cents). Every supported currency uses 100 minor units.
 */
public final class CurrencyUnits {

    private static final BigDecimal MINOR_PER_MAJOR = BigDecimal.valueOf(100);

    private CurrencyUnits() {}

    /** 5000 -> 500000; 10.005 -> 1001 (half-up). */
    public static long toMinorUnits(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("amount is required");
        }
        return amount.multiply(MINOR_PER_MAJOR).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    public static BigDecimal fromMinorUnits(long minor) {
        return BigDecimal.valueOf(minor).divide(MINOR_PER_MAJOR, 2, RoundingMode.UNNECESSARY);
    }
}
