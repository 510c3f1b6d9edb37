package com.netcracker.core.appstate.snapshot;

import com.netcracker.core.appstate.AppStateException;

public class SnapshotSerializationException extends AppStateException {

    public SnapshotSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
