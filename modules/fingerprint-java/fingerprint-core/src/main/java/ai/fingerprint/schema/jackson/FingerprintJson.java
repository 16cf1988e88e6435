package ai.fingerprint.schema.jackson;

import ai.fingerprint.FingerprintException;
import ai.fingerprint.profiles.Fingerprint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.time.ZonedDateTime;
import java.util.Map;

/**
 * JSON rendering of fingerprints and their views.
 */
public class FingerprintJson {

    private final ObjectMapper mapper;

    public FingerprintJson() {
        this(new ObjectMapper());
    }

    public FingerprintJson(ObjectMapper mapper) {
        SimpleModule module = new SimpleModule("fingerprint");
        module.addSerializer(ZonedDateTime.class, new ZonedDateTimeSerializer());
        module.addSerializer(new PairSerializer());
        module.addSerializer(new HistogramSketchSerializer());
        this.mapper = mapper.registerModule(module);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public String write(Map<String, ?> view) {
        try {
            return mapper.writeValueAsString(view);
        } catch (JsonProcessingException e) {
            throw new FingerprintException("Unable to serialize fingerprint view", e);
        }
    }

    public String toJson(Fingerprint fingerprint) {
        return write(fingerprint.toMap());
    }

    public String toDisplayJson(Fingerprint fingerprint) {
        return write(fingerprint.toDisplay());
    }

    public String toComparisonJson(Fingerprint fingerprint) {
        return write(fingerprint.toComparisonVector());
    }
}
