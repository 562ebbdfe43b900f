package io.mnemo.core.querylog;

import io.mnemo.core.feedback.MemoryFeedback;
import io.mnemo.core.retrieval.MemoryQueryResult;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Append-only history of deep queries and the feedback given on their results.
 */
public interface QueryLogStore {
    MemoryQueryLog logQuery(MemoryQueryResult result, String projectId) throws IOException;

    Optional<MemoryQueryLog> findQuery(String queryId) throws IOException;

    List<MemoryQueryLog> listRecentBySession(String sessionId, int limit) throws IOException;

    MemoryFeedback addFeedback(MemoryFeedback feedback) throws IOException;

    List<MemoryFeedback> listFeedbackForQuery(String queryId) throws IOException;
}
