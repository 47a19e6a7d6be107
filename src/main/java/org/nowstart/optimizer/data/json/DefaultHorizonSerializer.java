package org.nowstart.optimizer.data.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;

/**
 * Null serializer for horizon fields: an unset horizon is written as the default horizon of 1.
 * Attach with {@code @JsonSerialize(nullsUsing = DefaultHorizonSerializer.class)}; other nulls
 * are not affected.
 */
public class DefaultHorizonSerializer extends StdSerializer<Object> {

    public static final int DEFAULT_HORIZON = 1;

    public DefaultHorizonSerializer() {
        super(Object.class);
    }

    @Override
    public void serialize(Object value, JsonGenerator generator, SerializerProvider provider) throws IOException {
        generator.writeNumber(DEFAULT_HORIZON);
    }
}
