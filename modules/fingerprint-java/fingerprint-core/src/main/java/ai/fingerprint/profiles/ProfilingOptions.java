package ai.fingerprint.profiles;

import ai.fingerprint.cost.CostPolicy;
import ai.fingerprint.cost.DefaultCostPolicy;
import ai.fingerprint.cost.MaxCost;
import ai.fingerprint.temporal.Scale;

import java.util.Objects;

/**
 * Allows to customize what a fingerprinting pass computes.
 */
public class ProfilingOptions {

    public static final int DEFAULT_HISTOGRAM_K = 200;

    private final MaxCost maxCost;
    private final Scale scale;
    private final CostPolicy costPolicy;
    private final int histogramK;
    private final boolean verbose;

    private ProfilingOptions(Builder builder) {
        this.maxCost = builder.maxCost;
        this.scale = builder.scale;
        this.costPolicy = builder.costPolicy;
        this.histogramK = builder.histogramK;
        this.verbose = builder.verbose;
    }

    public MaxCost getMaxCost() {
        return maxCost;
    }

    public Scale getScale() {
        return scale;
    }

    public CostPolicy getCostPolicy() {
        return costPolicy;
    }

    public int getHistogramK() {
        return histogramK;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean allowsFullScan() {
        return costPolicy.allowsFullScan(maxCost);
    }

    public boolean allowsUnboundedComputation() {
        return costPolicy.allowsUnboundedComputation(maxCost);
    }

    public Builder toBuilder() {
        return new Builder()
            .maxCost(maxCost)
            .scale(scale)
            .costPolicy(costPolicy)
            .histogramK(histogramK)
            .verbose(verbose);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Sampled, linear-cost pass over raw (not bucketed) values.
     */
    public static ProfilingOptions defaults() {
        return builder().build();
    }

    @Override
    public String toString() {
        return String.format("{maxCost=%s, scale=%s, histogramK=%d}", maxCost, scale.propertyValue(), histogramK);
    }

    public static class Builder {

        private MaxCost maxCost = MaxCost.DEFAULT;
        private Scale scale = Scale.RAW;
        private CostPolicy costPolicy = new DefaultCostPolicy();
        private int histogramK = DEFAULT_HISTOGRAM_K;
        private boolean verbose;

        public Builder maxCost(MaxCost maxCost) {
            this.maxCost = Objects.requireNonNull(maxCost, "maxCost");
            return this;
        }

        public Builder scale(Scale scale) {
            this.scale = scale == null ? Scale.RAW : scale;
            return this;
        }

        public Builder costPolicy(CostPolicy costPolicy) {
            this.costPolicy = Objects.requireNonNull(costPolicy, "costPolicy");
            return this;
        }

        public Builder histogramK(int histogramK) {
            if (histogramK < 8) {
                throw new IllegalArgumentException("Histogram accuracy parameter should be at least 8, got " + histogramK);
            }
            this.histogramK = histogramK;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public ProfilingOptions build() {
            return new ProfilingOptions(this);
        }
    }
}
