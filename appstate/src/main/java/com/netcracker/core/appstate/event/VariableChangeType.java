package com.netcracker.core.appstate.event;

public enum VariableChangeType {
    ADDED,
    UPDATED,
    REMOVED
}
