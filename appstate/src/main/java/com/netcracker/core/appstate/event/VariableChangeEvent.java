package com.netcracker.core.appstate.event;

import com.netcracker.core.appstate.value.Value;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;

/**
 * Change of a dynamic variable.
 * <p>
 * {@code ADDED} carries only the new value, {@code REMOVED} only the old one,
 * {@code UPDATED} both (they may be equal).
 */
@lombok.Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VariableChangeEvent {
    @NonNull VariableChangeType type;
    @NonNull String variableName;
    @Nullable Value oldValue;
    @Nullable Value newValue;

    public static VariableChangeEvent added(String variableName, Value newValue) {
        return new VariableChangeEvent(VariableChangeType.ADDED, variableName, null, newValue);
    }

    public static VariableChangeEvent updated(String variableName, Value oldValue, Value newValue) {
        return new VariableChangeEvent(VariableChangeType.UPDATED, variableName, oldValue, newValue);
    }

    public static VariableChangeEvent removed(String variableName, Value oldValue) {
        return new VariableChangeEvent(VariableChangeType.REMOVED, variableName, oldValue, null);
    }
}
