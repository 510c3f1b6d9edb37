package com.netcracker.core.appstate.dispatch;

import com.netcracker.core.appstate.AppStateException;

/**
 * Raised on an attempt to delete a typed property. Typed properties can only be overwritten.
 */
public class InvalidOperationException extends AppStateException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
