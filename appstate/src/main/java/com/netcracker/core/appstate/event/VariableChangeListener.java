package com.netcracker.core.appstate.event;

/**
 * Receives dynamic variable changes on the thread performing the change, after the change is committed.
 */
@FunctionalInterface
public interface VariableChangeListener {

    void onVariableChanged(VariableChangeEvent event);
}
