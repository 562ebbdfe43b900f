package io.mnemo.core.querylog;

import io.mnemo.core.atom.MemoryAtom;
import io.mnemo.core.retrieval.MemoryQueryResult;
import java.util.List;

public record MemoryQueryLog(
    String id,
    String sessionId,
    String projectId,
    String query,
    String optionsJson,
    List<String> resultAtomIds,
    long latencyMs,
    long createdAt
) {
    public MemoryQueryLog {
        resultAtomIds = resultAtomIds == null ? List.of() : List.copyOf(resultAtomIds);
    }

    public static MemoryQueryLog from(MemoryQueryResult result, String projectId, String optionsJson) {
        return new MemoryQueryLog(
            result.queryId(),
            result.sessionId(),
            projectId == null || projectId.isBlank() ? "default" : projectId,
            result.query(),
            optionsJson,
            result.atoms().stream().map(MemoryAtom::id).toList(),
            result.latencyMs(),
            result.createdAt()
        );
    }
}
