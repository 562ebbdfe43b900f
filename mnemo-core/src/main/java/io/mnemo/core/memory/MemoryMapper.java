package io.mnemo.core.memory;

import io.mnemo.core.atom.MemoryAtom;
import io.mnemo.core.atom.Provenance;
import io.mnemo.core.atom.ProvenanceSource;
import io.mnemo.core.atom.Sensitivity;
import io.mnemo.core.text.TextSimilarity;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Converts between the storage-level {@link MemoryAtom} and the engine's
 * {@link Memory} view. Engine-only fields travel through {@link MetadataCodec}.
 */
public final class MemoryMapper {
    static final String CREATED_BY = "memory_service";
    private static final int DERIVED_TITLE_LENGTH = 60;

    private MemoryMapper() {
    }

    public static Memory toMemory(MemoryAtom atom) {
        MemoryMetadata metadata = MetadataCodec.decode(atom.provenance().sourceRef());
        String group = metadata.group() == null || metadata.group().isBlank()
            ? MemoryGroups.forAtomType(atom.atomType())
            : metadata.group();
        MemorySource source = metadata.source() != null
            ? MemorySource.fromWire(metadata.source())
            : atom.provenance().source() == ProvenanceSource.USER ? MemorySource.MANUAL : MemorySource.AUTO;
        Instant createdAt = resolveInstant(metadata.createdAt(), atom.createdAt());
        Instant updatedAt = resolveInstant(metadata.updatedAt(), atom.updatedAt());
        Instant lastAccessedAt = parseInstant(metadata.lastAccessedAt());

        return new Memory(
            atom.id(),
            atom.summary() == null || atom.summary().isBlank() ? deriveTitle(atom.content()) : atom.summary(),
            atom.content(),
            group,
            atom.keywords(),
            source,
            atom.confidence(),
            createdAt,
            updatedAt,
            metadata.accessCount() == null ? 0 : metadata.accessCount(),
            lastAccessedAt == null ? updatedAt : lastAccessedAt,
            metadata.relatedSessionIds(),
            metadata.relatedMemoryIds()
        );
    }

    /**
     * @param existing the stored atom being replaced, or {@code null} for a new
     *                 one; its storage-only fields (pin, sensitivity, session)
     *                 are carried over
     */
    public static MemoryAtom toAtom(Memory memory, String projectId, MemoryAtom existing) {
        MemoryMetadata metadata = new MemoryMetadata(
            memory.group(),
            memory.source().wireValue(),
            memory.accessCount(),
            memory.lastAccessedAt().toString(),
            memory.createdAt().toString(),
            memory.updatedAt().toString(),
            memory.relatedSessionIds(),
            memory.relatedMemoryIds(),
            TextSimilarity.contentHash(memory.content())
        );
        String sourceRef = MetadataCodec.encode(metadata);
        Provenance provenance = existing == null
            ? new Provenance(
                memory.source() == MemorySource.MANUAL ? ProvenanceSource.USER : ProvenanceSource.ASSISTANT,
                sourceRef,
                List.of(),
                CREATED_BY)
            : existing.provenance().withSourceRef(sourceRef);

        return new MemoryAtom(
            memory.id(),
            projectId,
            existing == null ? null : existing.sessionId(),
            existing == null ? null : existing.runId(),
            MemoryGroups.atomTypeFor(memory.group()),
            memory.content(),
            memory.title(),
            memory.tags(),
            provenance,
            memory.confidence(),
            existing == null ? Sensitivity.NORMAL : existing.sensitivity(),
            existing != null && existing.pinned(),
            memory.createdAt().toEpochMilli(),
            memory.updatedAt().toEpochMilli(),
            existing == null ? null : existing.expiresAt()
        );
    }

    /**
     * Content hash recorded in the atom's metadata, computed from the content
     * when the atom predates hashing.
     */
    public static String contentHashOf(MemoryAtom atom) {
        String stored = MetadataCodec.decode(atom.provenance().sourceRef()).contentHash();
        return stored == null || stored.isBlank() ? TextSimilarity.contentHash(atom.content()) : stored;
    }

    // Prefer the full-precision ISO value while it still agrees with the atom's millis.
    private static Instant resolveInstant(String iso, long epochMs) {
        Instant parsed = parseInstant(iso);
        if (parsed != null && parsed.toEpochMilli() == epochMs) {
            return parsed;
        }
        return Instant.ofEpochMilli(epochMs);
    }

    private static Instant parseInstant(String iso) {
        if (iso == null || iso.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(iso);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String deriveTitle(String content) {
        String trimmed = content == null ? "" : content.trim().replaceAll("\\s+", " ");
        if (trimmed.length() <= DERIVED_TITLE_LENGTH) {
            return trimmed;
        }
        return trimmed.substring(0, DERIVED_TITLE_LENGTH).trim() + "...";
    }
}
