package com.netcracker.core.appstate.property;

import com.netcracker.core.appstate.AppStateException;

/**
 * Raised when a typed property is declared with a Java type that maps to no {@link PropertyKind}.
 */
public class UnsupportedCoercionException extends AppStateException {

    public UnsupportedCoercionException(String propertyName, Class<?> type) {
        super("Property '" + propertyName + "' has unsupported type '" + type.getName() + "'");
    }
}
