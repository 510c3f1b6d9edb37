package com.netcracker.core.appstate.variable;

import com.netcracker.core.appstate.event.ChangeNotifier;
import com.netcracker.core.appstate.event.VariableChangeEvent;
import com.netcracker.core.appstate.value.Value;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Insertion-ordered dynamic variables, keyed by normalized name.
 * <p>
 * A variable exists only while it holds a value: setting {@code null} deletes it.
 * Every mutation is committed before the matching change event is fired.
 * Not thread-safe.
 */
@Slf4j
public class VariableStore {

    private final Map<String, Value> variables = new LinkedHashMap<>();
    private final ChangeNotifier notifier;

    public VariableStore(ChangeNotifier notifier) {
        this.notifier = Objects.requireNonNull(notifier, "notifier");
    }

    public Optional<Value> get(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    public int size() {
        return variables.size();
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(variables.keySet()));
    }

    /**
     * @return copy of the variables in insertion order
     */
    public Map<String, Value> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    /**
     * Adds, replaces or (with a {@code null} value) deletes a variable.
     * Setting {@code null} on an absent variable does nothing and fires nothing.
     *
     * @return the previous value, or {@code null} if the variable did not exist
     */
    @Nullable
    public Value set(String name, @Nullable Value value) {
        Objects.requireNonNull(name, "name");
        if (value == null) {
            Value previous = variables.remove(name);
            if (previous != null) {
                log.debug("Removed variable '{}'", name);
                notifier.fire(VariableChangeEvent.removed(name, previous));
            }
            return previous;
        }

        Value previous = variables.put(name, value);
        if (previous == null) {
            log.debug("Added variable '{}'", name);
            notifier.fire(VariableChangeEvent.added(name, value));
        } else {
            log.debug("Updated variable '{}'", name);
            notifier.fire(VariableChangeEvent.updated(name, previous, value));
        }
        return previous;
    }

    @Nullable
    public Value remove(String name) {
        return set(name, null);
    }

    /**
     * Removes every variable, one removal event per variable in insertion order.
     * A propagated listener failure does not stop the removals: the first failure is rethrown
     * once the store is empty, later ones are attached to it as suppressed.
     */
    public void clear() {
        List<String> names = new ArrayList<>(variables.keySet());
        RuntimeException failure = null;
        for (String name : names) {
            try {
                remove(name);
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
