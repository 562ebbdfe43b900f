package io.mnemo.core.consolidation;

import java.io.IOException;
import java.util.List;

public interface ConsolidationRunStore {
    ConsolidationRun begin(String runId, String projectId, long startedAt) throws IOException;

    void complete(String runId, ConsolidationResult stats, long completedAt) throws IOException;

    void fail(String runId, String error, long completedAt) throws IOException;

    /**
     * Most recent runs first.
     */
    List<ConsolidationRun> listRecent(String projectId, int limit) throws IOException;
}
