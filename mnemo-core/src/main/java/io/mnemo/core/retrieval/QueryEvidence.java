package io.mnemo.core.retrieval;

import java.util.List;

public record QueryEvidence(String atomId, double score, List<String> reasons) {
    public QueryEvidence {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}
