package com.netcracker.core.appstate;

/**
 * Base type of every failure raised by the state container.
 * <p>
 * All container errors are unchecked and reach the immediate caller synchronously;
 * nothing is retried internally.
 */
public class AppStateException extends RuntimeException {

    public AppStateException(String message) {
        super(message);
    }

    public AppStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
