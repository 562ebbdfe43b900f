package io.mnemo.core.memory;

import io.mnemo.core.atom.MemoryAtom;
import io.mnemo.core.text.TextSimilarity;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds an existing atom that a create request duplicates and folds the request
 * into it. Exact duplicates are matched by normalized content hash across the
 * whole project; near duplicates by token Jaccard within the same group.
 */
public final class DedupGate {
    public static final double NEAR_DUPLICATE_THRESHOLD = 0.9;

    public Optional<MemoryAtom> findDuplicate(List<MemoryAtom> projectAtoms, CreateMemoryInput input) {
        String targetHash = TextSimilarity.contentHash(input.content());
        for (MemoryAtom atom : projectAtoms) {
            if (targetHash.equals(MemoryMapper.contentHashOf(atom))) {
                return Optional.of(atom);
            }
        }

        Set<String> incomingTokens = TextSimilarity.tokenize(input.content());
        for (MemoryAtom atom : projectAtoms) {
            Memory existing = MemoryMapper.toMemory(atom);
            if (!existing.group().equals(input.group())) {
                continue;
            }
            double similarity = TextSimilarity.jaccard(TextSimilarity.tokenize(existing.content()), incomingTokens);
            if (similarity >= NEAR_DUPLICATE_THRESHOLD) {
                return Optional.of(atom);
            }
        }
        return Optional.empty();
    }

    /**
     * Tags are unioned. The incoming content wins only when it differs after
     * normalization and is strictly longer. A manual create upgrades the title
     * of an auto-derived memory.
     */
    public Memory merge(Memory existing, CreateMemoryInput input, Instant now) {
        Set<String> tags = new LinkedHashSet<>(existing.tags());
        tags.addAll(input.tags());

        String incomingNormalized = TextSimilarity.normalize(input.content());
        String existingNormalized = TextSimilarity.normalize(existing.content());
        boolean useIncoming = !incomingNormalized.isEmpty()
            && !incomingNormalized.equals(existingNormalized)
            && input.content().trim().length() > existing.content().trim().length();

        String title = existing.source() == MemorySource.AUTO && input.source() == MemorySource.MANUAL
            && !input.title().isBlank()
            ? input.title()
            : existing.title();

        return new Memory(
            existing.id(),
            title,
            useIncoming ? input.content() : existing.content(),
            existing.group(),
            List.copyOf(tags),
            existing.source(),
            existing.confidence(),
            existing.createdAt(),
            now,
            existing.accessCount(),
            existing.lastAccessedAt(),
            existing.relatedSessionIds(),
            existing.relatedMemoryIds()
        );
    }
}
