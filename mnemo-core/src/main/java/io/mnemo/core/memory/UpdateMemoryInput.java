package io.mnemo.core.memory;

import java.util.List;

/**
 * Partial update; {@code null} fields are left unchanged.
 */
public record UpdateMemoryInput(
    String title,
    String content,
    List<String> tags,
    String group,
    Double confidence,
    List<String> addRelatedMemoryIds,
    List<String> removeRelatedMemoryIds
) {
    public static UpdateMemoryInput content(String content) {
        return new UpdateMemoryInput(null, content, null, null, null, null, null);
    }

    public static UpdateMemoryInput tags(List<String> tags) {
        return new UpdateMemoryInput(null, null, tags, null, null, null, null);
    }
}
