package io.mnemo.core.retrieval;

import io.mnemo.core.text.TextSimilarity;

/**
 * Blend weights for the hybrid scorer. Each weight is clamped to [0, 1]
 * independently; they are not normalized to sum to one.
 */
public record RetrievalWeights(double lexical, double dense, double graph, double rerank) {
    public static final double DEFAULT_LEXICAL = 0.35;
    public static final double DEFAULT_DENSE = 0.4;
    public static final double DEFAULT_GRAPH = 0.15;
    public static final double DEFAULT_RERANK = 0.1;

    public RetrievalWeights {
        lexical = TextSimilarity.clamp01(lexical);
        dense = TextSimilarity.clamp01(dense);
        graph = TextSimilarity.clamp01(graph);
        rerank = TextSimilarity.clamp01(rerank);
    }

    public static RetrievalWeights defaults() {
        return new RetrievalWeights(DEFAULT_LEXICAL, DEFAULT_DENSE, DEFAULT_GRAPH, DEFAULT_RERANK);
    }

    public RetrievalWeights withoutGraph() {
        return new RetrievalWeights(lexical, dense, 0.0, rerank);
    }
}
