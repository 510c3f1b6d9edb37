package com.netcracker.core.appstate.value;

import java.math.BigDecimal;
import java.util.regex.Pattern;

public record StringValue(String value) implements Value {
    private static final Pattern INTEGER_LITERAL = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT_LITERAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    @Override
    public ValueKind kind() {
        return ValueKind.STRING;
    }

    @Override
    public String asString() {
        return value;
    }

    @Override
    public boolean asBoolean() {
        String literal = value.trim();
        if ("true".equalsIgnoreCase(literal)) {
            return true;
        }
        if ("false".equalsIgnoreCase(literal)) {
            return false;
        }
        throw CoercionException.of(this, ValueKind.BOOLEAN);
    }

    @Override
    public long asInteger() {
        String literal = value.trim();
        if (!INTEGER_LITERAL.matcher(literal).matches()) {
            throw CoercionException.of(this, ValueKind.INTEGER);
        }
        try {
            return Long.parseLong(literal);
        } catch (NumberFormatException e) {
            throw CoercionException.of(this, ValueKind.INTEGER, e);
        }
    }

    @Override
    public double asFloat() {
        String literal = value.trim();
        switch (literal) {
            case "NaN" -> {
                return Double.NaN;
            }
            case "Infinity", "+Infinity" -> {
                return Double.POSITIVE_INFINITY;
            }
            case "-Infinity" -> {
                return Double.NEGATIVE_INFINITY;
            }
            default -> {
                if (!FLOAT_LITERAL.matcher(literal).matches()) {
                    throw CoercionException.of(this, ValueKind.FLOAT);
                }
                try {
                    return new BigDecimal(literal).doubleValue();
                } catch (NumberFormatException e) {
                    throw CoercionException.of(this, ValueKind.FLOAT, e);
                }
            }
        }
    }

    /**
     * Exact decimal reading of this literal, used where a double round trip would lose digits.
     */
    public BigDecimal asDecimal() {
        String literal = value.trim();
        if (!FLOAT_LITERAL.matcher(literal).matches()) {
            throw CoercionException.of(this, ValueKind.FLOAT);
        }
        try {
            return new BigDecimal(literal);
        } catch (NumberFormatException e) {
            throw CoercionException.of(this, ValueKind.FLOAT, e);
        }
    }

    @Override
    public String toString() {
        return asString();
    }
}
