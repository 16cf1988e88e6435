/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package ai.fingerprint.schema.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes date-times as ISO-8601 strings in UTC.
 */
public class ZonedDateTimeSerializer extends StdSerializer<ZonedDateTime> {

    private static final String PATTERN = "yyyy-MM-dd'T'HH:mm:ss.SSSXXX";
    public static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern(PATTERN);

    public ZonedDateTimeSerializer() {
        super(ZonedDateTime.class);
    }

    @Override
    public void serialize(ZonedDateTime value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeString(value.withZoneSameInstant(ZoneOffset.UTC).format(FORMATTER));
    }
}
