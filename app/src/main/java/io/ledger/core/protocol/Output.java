package io.ledger.core.protocol;

import java.math.BigDecimal;

public record Output(String address, BigDecimal value) {

    /** Largest number of digits allowed before the decimal point. */
    public static final int MAX_INTEGER_DIGITS = 30;
    /** Largest number of significant fractional digits. */
    public static final int MAX_SCALE = 18;

    public Output {
        // 0E-900 and 0 are the same amount; keep the scale out of later arithmetic
        if (value != null) {
            value = value.stripTrailingZeros();
        }
    }

    /**
     * True when {@code value} is non-negative and fits the fixed-size decimal range the ledger
     * stores. Trailing zeros do not count, so {@code 1.500} and {@code 15e-1} are the same value.
     */
    public static boolean isValidValue(BigDecimal value) {
        if (value == null || value.signum() < 0) {
            return false;
        }
        BigDecimal stripped = value.stripTrailingZeros();
        long integerDigits = (long) stripped.precision() - stripped.scale();
        return integerDigits <= MAX_INTEGER_DIGITS && stripped.scale() <= MAX_SCALE;
    }
}
