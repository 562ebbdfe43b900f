package io.mnemo.core.atom;

import java.util.List;

/**
 * Durable storage unit for one fact, preference or instruction. Timestamps are
 * epoch milliseconds.
 */
public record MemoryAtom(
    String id,
    String projectId,
    String sessionId,
    String runId,
    AtomType atomType,
    String content,
    String summary,
    List<String> keywords,
    Provenance provenance,
    double confidence,
    Sensitivity sensitivity,
    boolean pinned,
    long createdAt,
    long updatedAt,
    Long expiresAt
) {
    public MemoryAtom {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        projectId = projectId == null || projectId.isBlank() ? "default" : projectId;
        atomType = atomType == null ? AtomType.SEMANTIC : atomType;
        content = content == null ? "" : content;
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        provenance = provenance == null ? Provenance.of(ProvenanceSource.ASSISTANT) : provenance;
        confidence = clampConfidence(confidence);
        sensitivity = sensitivity == null ? Sensitivity.NORMAL : sensitivity;
    }

    public MemoryAtom withPinned(boolean value) {
        return new MemoryAtom(id, projectId, sessionId, runId, atomType, content, summary, keywords, provenance,
            confidence, sensitivity, value, createdAt, updatedAt, expiresAt);
    }

    public MemoryAtom withSensitivity(Sensitivity value) {
        return new MemoryAtom(id, projectId, sessionId, runId, atomType, content, summary, keywords, provenance,
            confidence, value, pinned, createdAt, updatedAt, expiresAt);
    }

    public MemoryAtom withProvenance(Provenance value) {
        return new MemoryAtom(id, projectId, sessionId, runId, atomType, content, summary, keywords, value,
            confidence, sensitivity, pinned, createdAt, updatedAt, expiresAt);
    }

    public MemoryAtom withConfidence(double value, long updatedAtMs) {
        return new MemoryAtom(id, projectId, sessionId, runId, atomType, content, summary, keywords, provenance,
            value, sensitivity, pinned, createdAt, updatedAtMs, expiresAt);
    }

    private static double clampConfidence(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
