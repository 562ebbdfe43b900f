package io.mnemo.core.consolidation;

/**
 * One row of the consolidation run history. {@code stats} is present once the
 * run completed, {@code error} once it failed.
 */
public record ConsolidationRun(
    String id,
    String projectId,
    ConsolidationRunStatus status,
    ConsolidationResult stats,
    long startedAt,
    Long completedAt,
    String error
) {
}
