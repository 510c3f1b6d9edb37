package com.netcracker.core.appstate.property;

import com.netcracker.core.appstate.AppStateException;
import com.netcracker.core.appstate.value.CoercionException;
import com.netcracker.core.appstate.value.StringValue;
import com.netcracker.core.appstate.value.Value;
import com.netcracker.core.appstate.value.ValueKind;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * A statically declared, strongly-typed field of a state schema.
 *
 * @param name   declared name, exact casing
 * @param type   boxed Java type of the field
 * @param getter reads the field from a schema instance, {@code null} if the field is write-only
 * @param setter writes the field, {@code null} if the field is read-only
 * @param <S>    schema type
 * @param <T>    field type
 */
public record TypedProperty<S, T>(String name,
                                  Class<T> type,
                                  @Nullable Function<S, T> getter,
                                  @Nullable BiConsumer<S, T> setter) {

    public TypedProperty {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static <S, T> TypedProperty<S, T> of(String name,
                                                Class<T> type,
                                                @Nullable Function<S, T> getter,
                                                @Nullable BiConsumer<S, T> setter) {
        return new TypedProperty<>(name, type, getter, setter);
    }

    public String normalizedName() {
        return name.toLowerCase(Locale.ROOT);
    }

    public Optional<PropertyKind> kind() {
        return PropertyKind.of(type);
    }

    boolean isAccessible() {
        return getter != null && setter != null;
    }

    /**
     * Reads the field and wraps it as a value of the matching kind.
     * Decimal fields are read as floats.
     *
     * @throws AppStateException if the field holds {@code null}
     */
    public Value read(S state) {
        PropertyKind kind = requireKind();
        Object raw = Objects.requireNonNull(getter, "getter").apply(state);
        if (raw == null) {
            throw new AppStateException("Property '" + name + "' holds no value");
        }
        return switch (kind) {
            case STRING -> Value.of((String) raw);
            case BOOLEAN -> Value.of((Boolean) raw);
            case INTEGER -> Value.of(((Number) raw).longValue());
            // Float fields widen through their decimal form, so 2.1f reads as 2.1
            case FLOAT -> Value.of(raw instanceof Float f ? Double.parseDouble(f.toString()) : ((Number) raw).doubleValue());
            case DECIMAL_FLOAT -> Value.of(((BigDecimal) raw).doubleValue());
        };
    }

    /**
     * Coerces {@code value} into the field type and writes it.
     * Nothing is written when the coercion fails.
     *
     * @throws UnsupportedCoercionException if the field type has no kind
     * @throws CoercionException            if the value cannot be represented in the field type
     */
    public void write(S state, Value value) {
        Objects.requireNonNull(value, "value");
        T converted = type.cast(coerce(requireKind(), value));
        Objects.requireNonNull(setter, "setter").accept(state, converted);
    }

    private Object coerce(PropertyKind kind, Value value) {
        return switch (kind) {
            case STRING -> value.asString();
            case BOOLEAN -> value.asBoolean();
            case INTEGER -> coerceInteger(value);
            case FLOAT -> type == Float.class ? (Object) (float) value.asFloat() : (Object) value.asFloat();
            case DECIMAL_FLOAT -> coerceDecimal(value);
        };
    }

    private Object coerceInteger(Value value) {
        long integer = value.asInteger();
        if (type == Long.class) {
            return integer;
        }
        if (integer < Integer.MIN_VALUE || integer > Integer.MAX_VALUE) {
            throw new CoercionException("Value '" + value.asString() + "' is out of range for property '" + name + "'");
        }
        return (int) integer;
    }

    private BigDecimal coerceDecimal(Value value) {
        if (value instanceof StringValue string) {
            BigDecimal decimal = string.asDecimal();
            // decimals read back as doubles, so the literal must fit one
            if (Double.isInfinite(decimal.doubleValue())) {
                throw new CoercionException("Value '" + value.asString() + "' is out of range for property '" + name + "'");
            }
            return decimal;
        }
        if (value.kind() == ValueKind.INTEGER) {
            return BigDecimal.valueOf(value.asInteger());
        }
        double number = value.asFloat();
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            throw new CoercionException("Value '" + value.asString() + "' is not a finite decimal for property '" + name + "'");
        }
        return BigDecimal.valueOf(number);
    }

    private PropertyKind requireKind() {
        return kind().orElseThrow(() -> new UnsupportedCoercionException(name, type));
    }
}
