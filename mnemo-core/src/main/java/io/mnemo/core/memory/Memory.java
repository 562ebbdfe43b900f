package io.mnemo.core.memory;

import java.time.Instant;
import java.util.List;

/**
 * Logical view of a stored atom enriched with the engine's decoded metadata.
 */
public record Memory(
    String id,
    String title,
    String content,
    String group,
    List<String> tags,
    MemorySource source,
    double confidence,
    Instant createdAt,
    Instant updatedAt,
    int accessCount,
    Instant lastAccessedAt,
    List<String> relatedSessionIds,
    List<String> relatedMemoryIds
) {
    public Memory {
        title = title == null ? "" : title;
        content = content == null ? "" : content;
        group = group == null || group.isBlank() ? MemoryGroups.LEARNINGS : group;
        tags = tags == null ? List.of() : List.copyOf(tags);
        source = source == null ? MemorySource.MANUAL : source;
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
        updatedAt = updatedAt == null ? createdAt : updatedAt;
        accessCount = Math.max(0, accessCount);
        lastAccessedAt = lastAccessedAt == null ? updatedAt : lastAccessedAt;
        relatedSessionIds = relatedSessionIds == null ? List.of() : List.copyOf(relatedSessionIds);
        relatedMemoryIds = relatedMemoryIds == null ? List.of() : List.copyOf(relatedMemoryIds);
    }

    public Memory withAccess(int count, Instant accessedAt) {
        return new Memory(id, title, content, group, tags, source, confidence, createdAt, updatedAt,
            count, accessedAt, relatedSessionIds, relatedMemoryIds);
    }

    public Memory withRelatedSessionIds(List<String> sessionIds, Instant touchedAt) {
        return new Memory(id, title, content, group, tags, source, confidence, createdAt, touchedAt,
            accessCount, lastAccessedAt, sessionIds, relatedMemoryIds);
    }
}
