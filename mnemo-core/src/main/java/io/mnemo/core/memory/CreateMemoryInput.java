package io.mnemo.core.memory;

import java.util.List;

/**
 * @param confidence {@code null} selects the source default (0.7 auto, 1.0 manual)
 */
public record CreateMemoryInput(
    String title,
    String content,
    String group,
    List<String> tags,
    MemorySource source,
    Double confidence,
    List<String> relatedMemoryIds
) {
    public CreateMemoryInput {
        title = title == null ? "" : title.trim();
        content = content == null ? "" : content;
        group = group == null || group.isBlank() ? MemoryGroups.LEARNINGS : group.trim();
        tags = tags == null ? List.of() : List.copyOf(tags);
        source = source == null ? MemorySource.MANUAL : source;
        relatedMemoryIds = relatedMemoryIds == null ? List.of() : List.copyOf(relatedMemoryIds);
    }

    public CreateMemoryInput(String title, String content, String group, List<String> tags, MemorySource source) {
        this(title, content, group, tags, source, null, List.of());
    }

    public CreateMemoryInput withSource(MemorySource value) {
        return new CreateMemoryInput(title, content, group, tags, value, confidence, relatedMemoryIds);
    }

    public double resolvedConfidence() {
        if (confidence != null) {
            return confidence;
        }
        return source == MemorySource.AUTO ? 0.7 : 1.0;
    }
}
