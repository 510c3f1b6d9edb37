package com.netcracker.core.appstate.snapshot;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.netcracker.core.appstate.value.Value;

import java.io.IOException;

/**
 * Writes every {@link Value} as a JSON string of its textual form, whatever its kind.
 */
public class ValueJsonSerializer extends StdSerializer<Value> {

    public ValueJsonSerializer() {
        super(Value.class);
    }

    @Override
    public void serialize(Value value, JsonGenerator generator, SerializerProvider provider) throws IOException {
        generator.writeString(value.asString());
    }
}
