package com.netcracker.core.appstate.value;

public record BooleanValue(boolean value) implements Value {
    static final BooleanValue TRUE = new BooleanValue(true);
    static final BooleanValue FALSE = new BooleanValue(false);

    @Override
    public ValueKind kind() {
        return ValueKind.BOOLEAN;
    }

    @Override
    public String asString() {
        return value ? "true" : "false";
    }

    @Override
    public boolean asBoolean() {
        return value;
    }

    @Override
    public long asInteger() {
        return value ? 1L : 0L;
    }

    @Override
    public double asFloat() {
        return value ? 1.0 : 0.0;
    }

    @Override
    public String toString() {
        return asString();
    }
}
