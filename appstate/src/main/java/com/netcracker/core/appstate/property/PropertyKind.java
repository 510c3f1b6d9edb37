package com.netcracker.core.appstate.property;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of kinds a typed property may have.
 */
public enum PropertyKind {
    STRING,
    BOOLEAN,
    INTEGER,
    FLOAT,
    DECIMAL_FLOAT;

    private static final Map<Class<?>, PropertyKind> BY_TYPE = Map.of(
            String.class, STRING,
            Boolean.class, BOOLEAN,
            Integer.class, INTEGER,
            Long.class, INTEGER,
            Float.class, FLOAT,
            Double.class, FLOAT,
            BigDecimal.class, DECIMAL_FLOAT
    );

    /**
     * Resolves the kind of a declared Java type. Only boxed types are recognized;
     * declarations use method references, which box primitive accessors.
     *
     * @return the kind, or empty if values of {@code type} cannot be coerced
     */
    public static Optional<PropertyKind> of(Class<?> type) {
        return Optional.ofNullable(BY_TYPE.get(type));
    }
}
