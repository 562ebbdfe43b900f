package io.mnemo.core.consolidation;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class InMemoryConsolidationRunStore implements ConsolidationRunStore {
    private final Map<String, ConsolidationRun> runs = new LinkedHashMap<>();

    @Override
    public synchronized ConsolidationRun begin(String runId, String projectId, long startedAt) {
        ConsolidationRun run = new ConsolidationRun(runId, projectId, ConsolidationRunStatus.RUNNING, null, startedAt, null, null);
        runs.put(runId, run);
        return run;
    }

    @Override
    public synchronized void complete(String runId, ConsolidationResult stats, long completedAt) {
        ConsolidationRun run = runs.get(runId);
        if (run != null) {
            runs.put(runId, new ConsolidationRun(
                runId, run.projectId(), ConsolidationRunStatus.COMPLETED, stats, run.startedAt(), completedAt, null
            ));
        }
    }

    @Override
    public synchronized void fail(String runId, String error, long completedAt) {
        ConsolidationRun run = runs.get(runId);
        if (run != null) {
            runs.put(runId, new ConsolidationRun(
                runId, run.projectId(), ConsolidationRunStatus.FAILED, null, run.startedAt(), completedAt, error
            ));
        }
    }

    @Override
    public synchronized List<ConsolidationRun> listRecent(String projectId, int limit) {
        return runs.values().stream()
            .filter(run -> run.projectId().equals(projectId))
            .sorted(Comparator.comparingLong(ConsolidationRun::startedAt).reversed())
            .limit(Math.max(1, limit))
            .toList();
    }
}
