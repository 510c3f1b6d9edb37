package com.netcracker.core.appstate.value;

import com.netcracker.core.appstate.AppStateException;

/**
 * Raised when a value cannot be interpreted as the requested kind.
 */
public class CoercionException extends AppStateException {

    public CoercionException(String message) {
        super(message);
    }

    public CoercionException(String message, Throwable cause) {
        super(message, cause);
    }

    static CoercionException of(Value value, ValueKind target) {
        return new CoercionException("Cannot coerce " + value.kind() + " value '" + value.asString() + "' to " + target);
    }

    static CoercionException of(Value value, ValueKind target, Throwable cause) {
        return new CoercionException("Cannot coerce " + value.kind() + " value '" + value.asString() + "' to " + target, cause);
    }
}
