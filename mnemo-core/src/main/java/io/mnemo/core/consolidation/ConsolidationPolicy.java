package io.mnemo.core.consolidation;

/**
 * Tuning of one consolidation run. Out-of-range values are clamped, never
 * rejected, so every instance is runnable.
 */
public record ConsolidationPolicy(
    ConsolidationStrategy strategy,
    double redundancyThreshold,
    double decayFactor,
    double minConfidence,
    double staleAfterHours
) {
    public static final double DEFAULT_REDUNDANCY_THRESHOLD = 0.9;
    public static final double DEFAULT_DECAY_FACTOR = 0.92;
    public static final double DEFAULT_MIN_CONFIDENCE = 0.15;
    public static final double DEFAULT_STALE_AFTER_HOURS = 24 * 14;
    private static final double MAX_STALE_AFTER_HOURS = 24 * 365;

    public ConsolidationPolicy {
        strategy = strategy == null ? ConsolidationStrategy.BALANCED : strategy;
        redundancyThreshold = clamp(redundancyThreshold, 0.6, 0.99, DEFAULT_REDUNDANCY_THRESHOLD);
        decayFactor = clamp(decayFactor, 0.5, 0.999, DEFAULT_DECAY_FACTOR);
        minConfidence = clamp(minConfidence, 0.05, 0.95, DEFAULT_MIN_CONFIDENCE);
        staleAfterHours = Double.isNaN(staleAfterHours) || staleAfterHours <= 0
            ? DEFAULT_STALE_AFTER_HOURS
            : Math.min(MAX_STALE_AFTER_HOURS, Math.max(1, staleAfterHours));
    }

    public static ConsolidationPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public long staleAfterMillis() {
        return (long) (staleAfterHours * 60 * 60 * 1000);
    }

    private static double clamp(double value, double min, double max, double fallback) {
        if (Double.isNaN(value)) {
            return fallback;
        }
        return Math.max(min, Math.min(max, value));
    }

    public static final class Builder {
        private ConsolidationStrategy strategy;
        private Double redundancyThreshold;
        private Double decayFactor;
        private Double minConfidence;
        private Double staleAfterHours;

        private Builder() {
        }

        public Builder strategy(ConsolidationStrategy value) {
            this.strategy = value;
            return this;
        }

        public Builder redundancyThreshold(Double value) {
            this.redundancyThreshold = value;
            return this;
        }

        public Builder decayFactor(Double value) {
            this.decayFactor = value;
            return this;
        }

        public Builder minConfidence(Double value) {
            this.minConfidence = value;
            return this;
        }

        public Builder staleAfterHours(Double value) {
            this.staleAfterHours = value;
            return this;
        }

        public ConsolidationPolicy build() {
            return new ConsolidationPolicy(
                strategy,
                redundancyThreshold == null ? DEFAULT_REDUNDANCY_THRESHOLD : redundancyThreshold,
                decayFactor == null ? DEFAULT_DECAY_FACTOR : decayFactor,
                minConfidence == null ? DEFAULT_MIN_CONFIDENCE : minConfidence,
                staleAfterHours == null ? DEFAULT_STALE_AFTER_HOURS : staleAfterHours
            );
        }
    }
}
