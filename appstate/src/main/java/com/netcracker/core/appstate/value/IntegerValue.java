package com.netcracker.core.appstate.value;

public record IntegerValue(long value) implements Value {

    @Override
    public ValueKind kind() {
        return ValueKind.INTEGER;
    }

    @Override
    public String asString() {
        return Long.toString(value);
    }

    @Override
    public boolean asBoolean() {
        return value != 0L;
    }

    @Override
    public long asInteger() {
        return value;
    }

    @Override
    public double asFloat() {
        return value;
    }

    @Override
    public String toString() {
        return asString();
    }
}
