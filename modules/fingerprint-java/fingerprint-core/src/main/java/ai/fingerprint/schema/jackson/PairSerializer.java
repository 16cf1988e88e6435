package ai.fingerprint.schema.jackson;

import ai.fingerprint.util.Pair;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Writes a pair as a two element array.
 */
public class PairSerializer extends StdSerializer<Pair<?, ?>> {

    public PairSerializer() {
        super(Pair.class, false);
    }

    @Override
    public void serialize(Pair<?, ?> value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartArray();
        provider.defaultSerializeValue(value.left(), gen);
        provider.defaultSerializeValue(value.right(), gen);
        gen.writeEndArray();
    }
}
