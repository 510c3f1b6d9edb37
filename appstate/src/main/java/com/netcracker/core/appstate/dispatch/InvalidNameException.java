package com.netcracker.core.appstate.dispatch;

import com.netcracker.core.appstate.AppStateException;

public class InvalidNameException extends AppStateException {

    public InvalidNameException(String message) {
        super(message);
    }
}
