package io.mnemo.core.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Engine-private fields carried inside an atom's provenance reference. Every
 * field may be absent when decoding legacy or foreign rows.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MemoryMetadata(
    String group,
    String source,
    Integer accessCount,
    String lastAccessedAt,
    String createdAt,
    String updatedAt,
    List<String> relatedSessionIds,
    List<String> relatedMemoryIds,
    String contentHash
) {
    public static MemoryMetadata empty() {
        return new MemoryMetadata(null, null, null, null, null, null, null, null, null);
    }
}
