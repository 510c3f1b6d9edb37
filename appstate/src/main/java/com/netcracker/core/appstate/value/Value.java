package com.netcracker.core.appstate.value;

import java.util.Objects;

/**
 * A single script-visible value.
 * <p>
 * Exactly one of {@link StringValue}, {@link BooleanValue}, {@link IntegerValue} or {@link FloatValue}.
 * Values are immutable; changing a variable means storing another value.
 * <p>
 * {@link #asString()} never fails. The other accessors coerce across kinds:
 * <ul>
 *   <li>same kind is identity;</li>
 *   <li>boolean and integer map {@code true/false} to {@code 1/0}, any nonzero number is {@code true};</li>
 *   <li>float to integer truncates toward zero and never fails;</li>
 *   <li>strings are parsed with locale independent literal rules, a malformed literal raises
 *   {@link CoercionException}.</li>
 * </ul>
 */
public sealed interface Value permits StringValue, BooleanValue, IntegerValue, FloatValue {

    ValueKind kind();

    String asString();

    boolean asBoolean();

    long asInteger();

    double asFloat();

    static Value of(String value) {
        return new StringValue(Objects.requireNonNull(value, "value"));
    }

    static Value of(boolean value) {
        return value ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    static Value of(long value) {
        return new IntegerValue(value);
    }

    static Value of(double value) {
        return new FloatValue(value);
    }
}
