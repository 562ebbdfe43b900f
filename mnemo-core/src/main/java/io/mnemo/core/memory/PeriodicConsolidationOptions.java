package io.mnemo.core.memory;

import io.mnemo.core.consolidation.ConsolidationBudget;
import io.mnemo.core.consolidation.ConsolidationPolicy;

/**
 * @param force run even when disabled or not yet due
 */
public record PeriodicConsolidationOptions(
    boolean enabled,
    long intervalMinutes,
    boolean force,
    ConsolidationPolicy policy,
    ConsolidationBudget budget
) {
    public static final long DEFAULT_INTERVAL_MINUTES = 360;

    public PeriodicConsolidationOptions {
        intervalMinutes = intervalMinutes <= 0 ? DEFAULT_INTERVAL_MINUTES : intervalMinutes;
        policy = policy == null ? ConsolidationPolicy.defaults() : policy;
        budget = budget == null ? ConsolidationBudget.unbounded() : budget;
    }

    public static PeriodicConsolidationOptions forced(ConsolidationPolicy policy) {
        return new PeriodicConsolidationOptions(true, DEFAULT_INTERVAL_MINUTES, true, policy, null);
    }

    public long intervalMillis() {
        return intervalMinutes * 60_000L;
    }
}
