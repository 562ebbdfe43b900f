package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.mnemo.core.retrieval.QueryOptions;
import io.mnemo.core.retrieval.RetrievalWeights;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RetrievalConfig(
    int limit,
    double lexicalWeight,
    double denseWeight,
    double graphWeight,
    double rerankWeight
) {

    public static RetrievalConfig defaults() {
        return new RetrievalConfig(
            QueryOptions.DEFAULT_LIMIT,
            RetrievalWeights.DEFAULT_LEXICAL,
            RetrievalWeights.DEFAULT_DENSE,
            RetrievalWeights.DEFAULT_GRAPH,
            RetrievalWeights.DEFAULT_RERANK
        );
    }

    public QueryOptions.Builder toQueryOptions() {
        return QueryOptions.builder()
            .limit(limit)
            .lexicalWeight(lexicalWeight)
            .denseWeight(denseWeight)
            .graphWeight(graphWeight)
            .rerankWeight(rerankWeight);
    }
}
