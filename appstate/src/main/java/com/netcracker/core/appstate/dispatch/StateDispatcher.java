package com.netcracker.core.appstate.dispatch;

import com.netcracker.core.appstate.property.TypedProperty;
import com.netcracker.core.appstate.property.TypedPropertyRegistry;
import com.netcracker.core.appstate.value.Value;
import com.netcracker.core.appstate.variable.VariableStore;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;

/**
 * Single name-based entry point over typed properties and dynamic variables.
 * <p>
 * Every call normalizes the name first, then consults the typed property registry; only on a miss
 * is the variable store used. A variable therefore never shadows a typed property.
 *
 * @param <S> schema type holding the typed properties
 */
@Slf4j
public class StateDispatcher<S> {

    private final S state;
    private final TypedPropertyRegistry<S> registry;
    private final VariableStore variables;

    public StateDispatcher(S state, TypedPropertyRegistry<S> registry, VariableStore variables) {
        this.state = Objects.requireNonNull(state, "state");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.variables = Objects.requireNonNull(variables, "variables");
    }

    /**
     * @throws VariableNotFoundException if the name is neither a typed property nor a variable
     */
    public Value get(String name) {
        String normalizedName = VariableNames.normalize(name);
        return lookup(normalizedName).orElseThrow(() -> new VariableNotFoundException(normalizedName));
    }

    /**
     * @return the resolved value, or {@code defaultValue} if the name is unknown
     */
    @Nullable
    public Value get(String name, @Nullable Value defaultValue) {
        return lookup(VariableNames.normalize(name)).orElse(defaultValue);
    }

    public Optional<Value> find(String name) {
        return lookup(VariableNames.normalize(name));
    }

    public boolean has(String name) {
        String normalizedName = VariableNames.normalize(name);
        return registry.contains(normalizedName) || variables.contains(normalizedName);
    }

    public boolean isTypedProperty(String name) {
        return registry.contains(VariableNames.normalize(name));
    }

    /**
     * Writes a typed property or sets a variable. A {@code null} value deletes the variable
     * and is rejected for typed properties.
     *
     * @throws InvalidOperationException if {@code value} is null and the name is a typed property
     */
    public void set(String name, @Nullable Value value) {
        String normalizedName = VariableNames.normalize(name);
        Optional<TypedProperty<S, ?>> property = registry.resolve(normalizedName);
        if (property.isPresent()) {
            if (value == null) {
                throw new InvalidOperationException("Typed property '" + property.get().name() + "' cannot be removed");
            }
            log.debug("Writing typed property '{}'", property.get().name());
            property.get().write(state, value);
            return;
        }
        variables.set(normalizedName, value);
    }

    /**
     * Deletes a dynamic variable; does nothing if it does not exist.
     *
     * @throws InvalidOperationException if the name is a typed property
     */
    public void remove(String name) {
        set(name, null);
    }

    private Optional<Value> lookup(String normalizedName) {
        Optional<TypedProperty<S, ?>> property = registry.resolve(normalizedName);
        if (property.isPresent()) {
            log.debug("Reading typed property '{}'", property.get().name());
            return Optional.of(property.get().read(state));
        }
        return variables.get(normalizedName);
    }
}
