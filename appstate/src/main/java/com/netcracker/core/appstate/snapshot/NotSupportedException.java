package com.netcracker.core.appstate.snapshot;

import com.netcracker.core.appstate.AppStateException;

public class NotSupportedException extends AppStateException {

    public NotSupportedException(String message) {
        super(message);
    }
}
