package com.netcracker.core.appstate.script;

/**
 * A host word implemented in Java.
 */
@FunctionalInterface
public interface PrimitiveWord {

    void execute(ScriptStack stack);
}
