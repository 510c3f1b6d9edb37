package com.netcracker.core.appstate.value;

public enum ValueKind {
    STRING,
    BOOLEAN,
    INTEGER,
    FLOAT
}
