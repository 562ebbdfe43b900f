package io.mnemo.core.retrieval;

import io.mnemo.core.memory.Memory;
import io.mnemo.core.text.TextSimilarity;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * IDF-weighted term matching over title, content and tags. A query term scores
 * 1.0 on an exact token hit, 0.8 on a tag hit and 0.5 when it only occurs as a
 * substring; the memory's score is the matched share of the query's total IDF.
 */
public final class TermMatchLexicalRanker implements LexicalRanker {
    private static final double EXACT_HIT = 1.0;
    private static final double TAG_HIT = 0.8;
    private static final double SUBSTRING_HIT = 0.5;

    @Override
    public Map<String, Double> rank(List<Memory> candidates, String query) {
        List<String> terms = queryTerms(query);
        Map<String, Double> scores = new HashMap<>();
        if (terms.isEmpty() || candidates.isEmpty()) {
            return scores;
        }

        List<Document> documents = new ArrayList<>(candidates.size());
        for (Memory memory : candidates) {
            documents.add(Document.of(memory));
        }
        Map<String, Double> idf = inverseDocumentFrequency(documents, terms);
        double totalIdf = terms.stream().mapToDouble(idf::get).sum();

        for (Document document : documents) {
            double matched = 0.0;
            for (String term : terms) {
                matched += idf.get(term) * termScore(document, term);
            }
            scores.put(document.id(), totalIdf > 0 ? TextSimilarity.clamp01(matched / totalIdf) : 0.0);
        }
        return scores;
    }

    private double termScore(Document document, String term) {
        if (document.tokens().contains(term)) {
            return EXACT_HIT;
        }
        if (document.tagTokens().contains(term)) {
            return TAG_HIT;
        }
        if (document.text().contains(term)) {
            return SUBSTRING_HIT;
        }
        return 0.0;
    }

    private Map<String, Double> inverseDocumentFrequency(List<Document> documents, List<String> terms) {
        Map<String, Double> idf = new HashMap<>();
        int total = documents.size();
        for (String term : terms) {
            int docCount = 0;
            for (Document document : documents) {
                if (document.text().contains(term)) {
                    docCount++;
                }
            }
            idf.put(term, Math.log((total + 1.0) / (docCount + 1.0)) + 1.0);
        }
        return idf;
    }

    private List<String> queryTerms(String query) {
        List<String> terms = new ArrayList<>();
        for (String token : TextSimilarity.tokenize(query)) {
            if (!STOP_WORDS.contains(token)) {
                terms.add(token);
            }
        }
        return terms;
    }

    private record Document(String id, String text, Set<String> tokens, Set<String> tagTokens) {
        static Document of(Memory memory) {
            String text = TextSimilarity.normalize(memory.title() + " " + memory.content());
            return new Document(
                memory.id(),
                text,
                TextSimilarity.tokenize(text),
                TextSimilarity.tokenize(String.join(" ", memory.tags()).toLowerCase(Locale.ROOT))
            );
        }
    }

    private static final Set<String> STOP_WORDS = Set.of(
        "the", "and", "but", "for", "with", "from", "are", "was", "were", "been", "being", "this", "that",
        "these", "those", "have", "has", "had", "does", "did", "will", "would", "could", "should", "may",
        "might", "must", "shall", "can", "its", "then", "than", "too", "very", "just", "also", "only",
        "such", "not", "yes", "any", "all", "some", "more", "most", "other", "into", "out", "over", "under",
        "again", "once", "our", "you", "your", "she", "they", "their"
    );
}
