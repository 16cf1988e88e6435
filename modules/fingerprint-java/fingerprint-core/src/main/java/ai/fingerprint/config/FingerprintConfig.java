package ai.fingerprint.config;

import ai.fingerprint.cost.ComputationCost;
import ai.fingerprint.cost.MaxCost;
import ai.fingerprint.cost.QueryCost;
import ai.fingerprint.profiles.ProfilingOptions;
import ai.fingerprint.temporal.Scale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

import static ai.fingerprint.FingerprintPropertyNames.FINGERPRINT__HISTOGRAM__K;
import static ai.fingerprint.FingerprintPropertyNames.FINGERPRINT__MAX_COST__COMPUTATION;
import static ai.fingerprint.FingerprintPropertyNames.FINGERPRINT__MAX_COST__QUERY;
import static ai.fingerprint.FingerprintPropertyNames.FINGERPRINT__SCALE;
import static ai.fingerprint.FingerprintPropertyNames.FINGERPRINT__VERBOSE;

/**
 * Fingerprinting configuration.
 */
public class FingerprintConfig implements PropertiesSource {

    private static final Logger LOG = LoggerFactory.getLogger(FingerprintConfig.class);

    private final Map<String, String> props;
    private final Scale scale;
    private final MaxCost maxCost;
    private final int histogramK;
    private final boolean verbose;

    /**
     * Default override order, from higher priority to lowest:
     * 1. Process environment variables
     * 2. Java process system properties
     */
    public FingerprintConfig() {
        this(
            new Env(
                new JavaOpts()
            )
        );
    }

    public FingerprintConfig(PropertiesSource source) {
        this.props = source.values();

        scale = source.getParsed(FINGERPRINT__SCALE, Scale::fromPropertyValue)
            .orElse(Scale.RAW);
        QueryCost query = source.getParsed(FINGERPRINT__MAX_COST__QUERY, QueryCost::fromPropertyValue)
            .orElse(MaxCost.DEFAULT.getQuery());
        ComputationCost computation = source.getParsed(FINGERPRINT__MAX_COST__COMPUTATION, ComputationCost::fromPropertyValue)
            .orElse(MaxCost.DEFAULT.getComputation());
        maxCost = new MaxCost(query, computation);
        histogramK = source.getInt(FINGERPRINT__HISTOGRAM__K, ProfilingOptions.DEFAULT_HISTOGRAM_K);
        verbose = source.isTrue(FINGERPRINT__VERBOSE);

        LOG.debug("Fingerprint configuration: scale={}, maxCost={}, histogramK={}", scale.propertyValue(), maxCost, histogramK);
    }

    public Scale scale() {
        return scale;
    }

    public MaxCost maxCost() {
        return maxCost;
    }

    public int histogramK() {
        return histogramK;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public ProfilingOptions profilingOptions() {
        return ProfilingOptions.builder()
            .scale(scale)
            .maxCost(maxCost)
            .histogramK(histogramK)
            .verbose(verbose)
            .build();
    }

    @Override
    public Map<String, String> values() {
        return Collections.unmodifiableMap(props);
    }

    @Override
    public Optional<String> getValue(String key) {
        return Optional.ofNullable(props.get(key));
    }

}
