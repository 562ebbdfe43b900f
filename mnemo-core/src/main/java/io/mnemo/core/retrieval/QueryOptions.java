package io.mnemo.core.retrieval;

/**
 * Resolved options of a deep query. Use {@link #builder()} to supply partial,
 * possibly out-of-range values; {@link Builder#build()} clamps and defaults them.
 */
public record QueryOptions(
    int limit,
    boolean includeSensitive,
    boolean includeGraphExpansion,
    RetrievalWeights weights
) {
    public static final int DEFAULT_LIMIT = 8;
    public static final int MAX_LIMIT = 50;

    public QueryOptions {
        limit = Math.max(1, Math.min(MAX_LIMIT, limit));
        weights = weights == null ? RetrievalWeights.defaults() : weights;
    }

    public static QueryOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Weights actually fed to the scorer: the graph signal is dropped when
     * graph expansion is disabled.
     */
    public RetrievalWeights effectiveWeights() {
        return includeGraphExpansion ? weights : weights.withoutGraph();
    }

    public static final class Builder {
        private Integer limit;
        private Boolean includeSensitive;
        private Boolean includeGraphExpansion;
        private Double lexicalWeight;
        private Double denseWeight;
        private Double graphWeight;
        private Double rerankWeight;

        private Builder() {
        }

        public Builder limit(Integer value) {
            this.limit = value;
            return this;
        }

        public Builder includeSensitive(Boolean value) {
            this.includeSensitive = value;
            return this;
        }

        public Builder includeGraphExpansion(Boolean value) {
            this.includeGraphExpansion = value;
            return this;
        }

        public Builder lexicalWeight(Double value) {
            this.lexicalWeight = value;
            return this;
        }

        public Builder denseWeight(Double value) {
            this.denseWeight = value;
            return this;
        }

        public Builder graphWeight(Double value) {
            this.graphWeight = value;
            return this;
        }

        public Builder rerankWeight(Double value) {
            this.rerankWeight = value;
            return this;
        }

        public Builder weights(RetrievalWeights value) {
            if (value != null) {
                lexicalWeight = value.lexical();
                denseWeight = value.dense();
                graphWeight = value.graph();
                rerankWeight = value.rerank();
            }
            return this;
        }

        public QueryOptions build() {
            return new QueryOptions(
                limit == null ? DEFAULT_LIMIT : limit,
                includeSensitive != null && includeSensitive,
                includeGraphExpansion == null || includeGraphExpansion,
                new RetrievalWeights(
                    orDefault(lexicalWeight, RetrievalWeights.DEFAULT_LEXICAL),
                    orDefault(denseWeight, RetrievalWeights.DEFAULT_DENSE),
                    orDefault(graphWeight, RetrievalWeights.DEFAULT_GRAPH),
                    orDefault(rerankWeight, RetrievalWeights.DEFAULT_RERANK)
                )
            );
        }

        private static double orDefault(Double value, double fallback) {
            return value == null || value.isNaN() ? fallback : value;
        }
    }
}
