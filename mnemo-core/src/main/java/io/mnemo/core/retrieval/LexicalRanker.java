package io.mnemo.core.retrieval;

import io.mnemo.core.memory.Memory;
import java.util.List;
import java.util.Map;

/**
 * Term-matching signal of the hybrid scorer. Implementations return a score in
 * [0, 1] per memory id; ids missing from the map score zero.
 */
public interface LexicalRanker {
    Map<String, Double> rank(List<Memory> candidates, String query);
}
