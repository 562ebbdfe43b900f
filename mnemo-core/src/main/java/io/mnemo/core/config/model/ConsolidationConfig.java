package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.mnemo.core.consolidation.ConsolidationBudget;
import io.mnemo.core.consolidation.ConsolidationPolicy;
import io.mnemo.core.consolidation.ConsolidationStrategy;
import io.mnemo.core.memory.PeriodicConsolidationOptions;
import java.time.Duration;

/**
 * @param maxDurationSeconds 0 runs without a time budget
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConsolidationConfig(
    boolean enabled,
    long intervalMinutes,
    String strategy,
    double redundancyThreshold,
    double decayFactor,
    double minConfidence,
    double staleAfterHours,
    long maxDurationSeconds
) {

    public static ConsolidationConfig defaults() {
        return new ConsolidationConfig(
            true,
            PeriodicConsolidationOptions.DEFAULT_INTERVAL_MINUTES,
            ConsolidationStrategy.BALANCED.wireValue(),
            ConsolidationPolicy.DEFAULT_REDUNDANCY_THRESHOLD,
            ConsolidationPolicy.DEFAULT_DECAY_FACTOR,
            ConsolidationPolicy.DEFAULT_MIN_CONFIDENCE,
            ConsolidationPolicy.DEFAULT_STALE_AFTER_HOURS,
            0
        );
    }

    public ConsolidationPolicy policy() {
        return ConsolidationPolicy.builder()
            .strategy(ConsolidationStrategy.fromWire(strategy))
            .redundancyThreshold(redundancyThreshold)
            .decayFactor(decayFactor)
            .minConfidence(minConfidence)
            .staleAfterHours(staleAfterHours)
            .build();
    }

    public ConsolidationBudget budget() {
        return ConsolidationBudget.of(Duration.ofSeconds(Math.max(0, maxDurationSeconds)));
    }

    public PeriodicConsolidationOptions periodic(boolean force) {
        return new PeriodicConsolidationOptions(enabled, intervalMinutes, force, policy(), budget());
    }
}
