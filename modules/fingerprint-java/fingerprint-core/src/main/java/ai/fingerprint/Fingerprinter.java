package ai.fingerprint;

import ai.fingerprint.aggregate.Aggregator;
import ai.fingerprint.config.FingerprintConfig;
import ai.fingerprint.profiles.DefaultProfiler;
import ai.fingerprint.profiles.Fingerprint;
import ai.fingerprint.profiles.ProfilerStrategy;
import ai.fingerprint.profiles.ProfilingOptions;
import ai.fingerprint.profiles.VariantResolver;
import ai.fingerprint.types.Field;
import ai.fingerprint.types.TypeSignature;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Entry point of fingerprinting: resolves the variant of the profiled fields and runs one pass over
 * their values.
 * <pre>
 *     Fingerprinter fingerprinter = new Fingerprinter();
 *     Fingerprint fp = fingerprinter.fingerprint(values, Field.of("price", SemanticType.FLOAT));
 *     Map&lt;String, Object&gt; xray = fingerprinter.toDisplay(fp);
 * </pre>
 */
public class Fingerprinter {

    private static final FingerprintAppLog LOG = new FingerprintAppLog(LoggerFactory.getLogger(Fingerprinter.class));

    private final ProfilingOptions defaults;
    private final VariantResolver resolver;
    private final ProfilerStrategy fallback;
    private final FingerprintAppLog log;

    public Fingerprinter(ProfilingOptions defaults, VariantResolver resolver) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.fallback = new DefaultProfiler();
        this.log = LOG.withVerbose(defaults.isVerbose());
    }

    public Fingerprinter(FingerprintConfig config) {
        this(config.profilingOptions(), new VariantResolver());
    }

    public Fingerprinter() {
        this(new FingerprintConfig());
    }

    /**
     * Profiler of the signature, the default one when no variant handles it.
     */
    public ProfilerStrategy resolveVariant(TypeSignature signature) {
        return resolver.resolve(signature)
            .orElseGet(() -> {
                log.info("No fingerprint variant for {}, only counts will be collected", signature);
                return fallback;
            });
    }

    public Aggregator<?, Object, Fingerprint> buildAggregator(ProfilingOptions options, Field... fields) {
        ProfilerStrategy strategy = resolveVariant(TypeSignature.of(fields));
        log.verbose("Profiling {} with {} strategy, options {}", names(fields), strategy.name(), options);
        return strategy.aggregator(options, fields);
    }

    public Aggregator<?, Object, Fingerprint> buildAggregator(Field... fields) {
        return buildAggregator(defaults, fields);
    }

    /**
     * Fingerprints all values in one pass. Items of two fields are pairs of values.
     */
    public Fingerprint fingerprint(ProfilingOptions options, Iterable<?> values, Field... fields) {
        FingerprintPass pass = begin(options, fields);
        for (Object value : values) {
            pass.add(value);
        }
        return pass.finish();
    }

    public Fingerprint fingerprint(Iterable<?> values, Field... fields) {
        return fingerprint(defaults, values, fields);
    }

    /**
     * Starts a pass that is fed one value at a time.
     */
    public FingerprintPass begin(ProfilingOptions options, Field... fields) {
        return FingerprintPass.of(buildAggregator(options, fields));
    }

    public FingerprintPass begin(Field... fields) {
        return begin(defaults, fields);
    }

    public Map<String, Object> toDisplay(Fingerprint fingerprint) {
        return fingerprint.toDisplay();
    }

    public Map<String, Object> toComparisonVector(Fingerprint fingerprint) {
        return fingerprint.toComparisonVector();
    }

    private static String names(Field... fields) {
        StringBuilder names = new StringBuilder();
        for (Field field : fields) {
            if (names.length() > 0) {
                names.append(", ");
            }
            names.append(field.getName());
        }
        return names.toString();
    }
}
