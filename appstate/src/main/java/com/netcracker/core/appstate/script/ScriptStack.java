package com.netcracker.core.appstate.script;

import com.netcracker.core.appstate.value.Value;

/**
 * Operand stack of the scripting host, as seen by {@link PrimitiveWord}s.
 */
public interface ScriptStack {

    /**
     * Fails the current word if the stack holds fewer than {@code count} values.
     */
    void expect(int count);

    Value pop();

    void push(Value value);
}
