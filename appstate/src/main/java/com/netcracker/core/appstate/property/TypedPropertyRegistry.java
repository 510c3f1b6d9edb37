package com.netcracker.core.appstate.property;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Case-insensitive table of the typed properties declared by a state schema.
 * <p>
 * The table is built from the schema's declarations on first use and cached for the lifetime of the
 * registry; the schema is fixed, so there is no invalidation. Building uses double-checked locking,
 * after which the table is read-only and may be shared between threads.
 * <p>
 * Declarations lacking a getter or a setter are skipped. Two declarations whose normalized names
 * collide make the build fail.
 *
 * @param <S> schema type
 */
@Slf4j
public final class TypedPropertyRegistry<S> {

    private final Supplier<List<TypedProperty<S, ?>>> declarations;

    private volatile Map<String, TypedProperty<S, ?>> properties;

    public TypedPropertyRegistry(Supplier<List<TypedProperty<S, ?>>> declarations) {
        this.declarations = Objects.requireNonNull(declarations, "declarations");
    }

    /**
     * Looks up a property by its normalized (lowercase) name.
     */
    public Optional<TypedProperty<S, ?>> resolve(String normalizedName) {
        Objects.requireNonNull(normalizedName, "normalizedName");
        return Optional.ofNullable(table().get(normalizedName));
    }

    public boolean contains(String normalizedName) {
        return resolve(normalizedName).isPresent();
    }

    /**
     * @return registered properties in declaration order
     */
    public List<TypedProperty<S, ?>> properties() {
        return List.copyOf(table().values());
    }

    private Map<String, TypedProperty<S, ?>> table() {
        Map<String, TypedProperty<S, ?>> table = properties;
        if (table == null) {
            synchronized (this) {
                table = properties;
                if (table == null) {
                    table = build();
                    properties = table;
                }
            }
        }
        return table;
    }

    private Map<String, TypedProperty<S, ?>> build() {
        List<TypedProperty<S, ?>> declared = new ArrayList<>(declarations.get());
        Map<String, TypedProperty<S, ?>> table = new LinkedHashMap<>();
        for (TypedProperty<S, ?> property : declared) {
            if (!property.isAccessible()) {
                log.debug("Skipping property '{}' without both a getter and a setter", property.name());
                continue;
            }
            TypedProperty<S, ?> previous = table.putIfAbsent(property.normalizedName(), property);
            if (previous != null) {
                throw new IllegalStateException("Properties '" + previous.name() + "' and '" + property.name()
                        + "' share the normalized name '" + property.normalizedName() + "'");
            }
            if (property.kind().isEmpty()) {
                log.warn("Property '{}' has unsupported type '{}', reads and writes of it will fail",
                        property.name(), property.type().getName());
            }
        }
        log.debug("Built typed property registry with {} entries: {}", table.size(), table.keySet());
        return Collections.unmodifiableMap(table);
    }
}
