package io.mnemo.core.querylog;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mnemo.core.feedback.MemoryFeedback;
import io.mnemo.core.retrieval.MemoryQueryResult;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public final class InMemoryQueryLogStore implements QueryLogStore {
    private final List<MemoryQueryLog> queries = new ArrayList<>();
    private final List<MemoryFeedback> feedback = new ArrayList<>();
    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public synchronized MemoryQueryLog logQuery(MemoryQueryResult result, String projectId) throws IOException {
        MemoryQueryLog log = MemoryQueryLog.from(result, projectId, mapper.writeValueAsString(result.options()));
        queries.add(log);
        return log;
    }

    @Override
    public synchronized Optional<MemoryQueryLog> findQuery(String queryId) {
        return queries.stream().filter(log -> log.id().equals(queryId)).findFirst();
    }

    @Override
    public synchronized List<MemoryQueryLog> listRecentBySession(String sessionId, int limit) {
        return queries.stream()
            .filter(log -> sessionId.equals(log.sessionId()))
            .sorted(Comparator.comparingLong(MemoryQueryLog::createdAt).reversed())
            .limit(Math.max(1, limit))
            .toList();
    }

    @Override
    public synchronized MemoryFeedback addFeedback(MemoryFeedback entry) {
        feedback.add(entry);
        return entry;
    }

    @Override
    public synchronized List<MemoryFeedback> listFeedbackForQuery(String queryId) {
        return feedback.stream()
            .filter(entry -> queryId.equals(entry.queryId()))
            .sorted(Comparator.comparingLong(MemoryFeedback::createdAt).reversed())
            .toList();
    }
}
