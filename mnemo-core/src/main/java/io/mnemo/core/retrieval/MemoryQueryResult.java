package io.mnemo.core.retrieval;

import io.mnemo.core.atom.MemoryAtom;
import java.util.List;

public record MemoryQueryResult(
    String queryId,
    String sessionId,
    String query,
    QueryOptions options,
    List<QueryEvidence> evidence,
    List<MemoryAtom> atoms,
    int totalCandidates,
    long latencyMs,
    long createdAt
) {
    public MemoryQueryResult {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        atoms = atoms == null ? List.of() : List.copyOf(atoms);
    }
}
