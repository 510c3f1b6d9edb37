package com.netcracker.core.appstate.dispatch;

import com.netcracker.core.appstate.AppStateException;
import lombok.Getter;

/**
 * Raised when a name is neither a typed property nor a known variable and no default was given.
 */
@Getter
public class VariableNotFoundException extends AppStateException {
    private final String variableName;

    public VariableNotFoundException(String variableName) {
        super("Variable '" + variableName + "' does not exist");
        this.variableName = variableName;
    }
}
