package io.mnemo.core.memory;

import java.util.List;

/**
 * Filters for {@code MemoryService#search}; {@code null} or empty means "any".
 */
public record MemorySearchOptions(
    String query,
    List<String> groups,
    MemorySource source,
    Double minConfidence,
    List<String> tags,
    Integer limit
) {
    public MemorySearchOptions {
        groups = groups == null ? List.of() : List.copyOf(groups);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static MemorySearchOptions query(String query) {
        return new MemorySearchOptions(query, null, null, null, null, null);
    }
}
