package com.netcracker.core.appstate.value;

import java.math.BigDecimal;

/**
 * Double precision value.
 * <p>
 * Renders as the shortest decimal that reads back to the same double, without a trailing {@code .0}.
 * Magnitudes outside {@code [1e-7, 1e21)} use exponent notation, e.g. {@code 1E+21}.
 */
public record FloatValue(double value) implements Value {
    private static final BigDecimal PLAIN_UPPER_BOUND = new BigDecimal("1E+21");
    private static final BigDecimal PLAIN_LOWER_BOUND = new BigDecimal("1E-7");

    @Override
    public ValueKind kind() {
        return ValueKind.FLOAT;
    }

    @Override
    public String asString() {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
        BigDecimal magnitude = decimal.abs();
        if (decimal.signum() != 0
                && (magnitude.compareTo(PLAIN_UPPER_BOUND) >= 0 || magnitude.compareTo(PLAIN_LOWER_BOUND) < 0)) {
            return decimal.toString();
        }
        return decimal.toPlainString();
    }

    @Override
    public boolean asBoolean() {
        return value != 0.0;
    }

    @Override
    public long asInteger() {
        return (long) value;
    }

    @Override
    public double asFloat() {
        return value;
    }

    @Override
    public String toString() {
        return asString();
    }
}
