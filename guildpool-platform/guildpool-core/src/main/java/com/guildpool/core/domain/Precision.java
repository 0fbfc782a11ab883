package com.guildpool.core.domain;

import java.math.BigInteger;

/**
 * Fixed-point arithmetic shared by distrust ratios and recipient shares.
 * One full unit ({@link #ONE}) represents 100%.
 */
public final class Precision {

    public static final BigInteger ONE = BigInteger.TEN.pow(18);

    private Precision() {}

    /**
     * Computes {@code value * numerator / denominator} with truncation, or zero when the denominator is zero.
     */
    public static BigInteger mulDiv(BigInteger value, BigInteger numerator, BigInteger denominator) {
        if (denominator.signum() == 0) {
            return BigInteger.ZERO;
        }
        return value.multiply(numerator).divide(denominator);
    }

    public static BigInteger requireNonNegative(BigInteger amount, String name) {
        if (amount == null) {
            throw new NullPointerException(name + " cannot be null");
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException(name + " cannot be negative: " + amount);
        }
        return amount;
    }
}
