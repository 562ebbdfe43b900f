package io.mnemo.core.consolidation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ConsolidationResult(
    String runId,
    ConsolidationStrategy strategy,
    long startedAt,
    long completedAt,
    int beforeCount,
    int afterCount,
    int mergedCount,
    int removedCount,
    int decayedCount,
    int preservedPinnedCount,
    double redundancyReduction,
    double recallRetention
) {
}
