package io.mnemo.core.retrieval;

import io.mnemo.core.memory.Memory;
import io.mnemo.core.memory.ScoredMemory;
import io.mnemo.core.text.TextSimilarity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Blends lexical, token-overlap ("dense"), graph and exact-match ("rerank")
 * signals into one relevance score per memory.
 *
 * <p>{@code final = clamp01((lexical*wLex + dense*wDense + graph*wGraph + rerank*wRerank)
 * * (0.7 + 0.3*coverage) * confidence)}. Results scoring at or below
 * {@link #MIN_SCORE} are dropped before the limit is applied.
 */
public final class HybridRelevanceScorer {
    public static final double MIN_SCORE = 0.05;

    private final LexicalRanker lexicalRanker;

    public HybridRelevanceScorer() {
        this(new TermMatchLexicalRanker());
    }

    public HybridRelevanceScorer(LexicalRanker lexicalRanker) {
        this.lexicalRanker = Objects.requireNonNull(lexicalRanker, "lexicalRanker must not be null");
    }

    /**
     * Best-first scored memories, at most {@code limit} of them. A non-positive
     * limit yields nothing.
     */
    public List<ScoredMemory> score(List<Memory> memories, String query, RetrievalWeights weights, int limit) {
        if (limit <= 0 || query == null || query.isBlank() || memories == null || memories.isEmpty()) {
            return List.of();
        }
        RetrievalWeights safeWeights = weights == null ? RetrievalWeights.defaults() : weights;
        Set<String> queryTokens = TextSimilarity.tokenize(query);
        Map<String, Double> lexicalScores = lexicalRanker.rank(memories, query);

        List<ScoredMemory> scored = new ArrayList<>();
        for (Memory memory : memories) {
            double score = scoreOne(memory, query, queryTokens, lexicalScores, safeWeights);
            if (score > MIN_SCORE) {
                scored.add(new ScoredMemory(memory, score));
            }
        }
        return scored.stream()
            .sorted(Comparator.comparingDouble(ScoredMemory::relevanceScore).reversed())
            .limit(limit)
            .toList();
    }

    private double scoreOne(
        Memory memory,
        String query,
        Set<String> queryTokens,
        Map<String, Double> lexicalScores,
        RetrievalWeights weights
    ) {
        Set<String> memoryTokens = TextSimilarity.tokenize(memory.title() + " " + memory.content());
        double lexical = TextSimilarity.clamp01(lexicalScores.getOrDefault(memory.id(), 0.0));
        double dense = TextSimilarity.jaccard(queryTokens, memoryTokens);
        double graph = graphScore(memory);
        double rerank = rerankScore(memory, query);
        double coverageFactor = 0.7 + 0.3 * TextSimilarity.coverage(queryTokens, memoryTokens);

        double raw = lexical * weights.lexical()
            + dense * weights.dense()
            + graph * weights.graph()
            + rerank * weights.rerank();
        return TextSimilarity.clamp01(raw * coverageFactor * memory.confidence());
    }

    static double graphScore(Memory memory) {
        double memoryLinks = Math.min(1.0, memory.relatedMemoryIds().size() / 5.0);
        double sessionLinks = 0.6 * Math.min(1.0, memory.relatedSessionIds().size() / 8.0);
        return Math.max(memoryLinks, sessionLinks);
    }

    static double rerankScore(Memory memory, String query) {
        String needle = query.trim().toLowerCase(Locale.ROOT);
        String title = memory.title().trim().toLowerCase(Locale.ROOT);
        if (title.equals(needle)) {
            return 1.0;
        }
        if (title.contains(needle)) {
            return 0.9;
        }
        if (memory.content().toLowerCase(Locale.ROOT).contains(needle)) {
            return 0.75;
        }
        for (String tag : memory.tags()) {
            String normalizedTag = tag == null ? "" : tag.trim().toLowerCase(Locale.ROOT);
            if (!normalizedTag.isEmpty() && needle.contains(normalizedTag)) {
                return 0.55;
            }
        }
        return 0.2;
    }
}
