package ai.fingerprint.schema.jackson;

import ai.fingerprint.sketch.HistogramSketch;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Writes the summary of a histogram sketch, sketches themselves are not serializable.
 */
public class HistogramSketchSerializer extends StdSerializer<HistogramSketch<?>> {

    public HistogramSketchSerializer() {
        super(HistogramSketch.class, false);
    }

    @Override
    public void serialize(HistogramSketch<?> value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        provider.defaultSerializeValue(value.toMap(), gen);
    }
}
