package io.mnemo.core.atom;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Who created an atom and why. {@code sourceRef} doubles as the carrier of the
 * engine's encoded metadata blob.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Provenance(
    ProvenanceSource source,
    String sourceRef,
    List<String> tags,
    String createdBy
) {
    public Provenance {
        source = source == null ? ProvenanceSource.ASSISTANT : source;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static Provenance of(ProvenanceSource source) {
        return new Provenance(source, null, List.of(), null);
    }

    public Provenance withSourceRef(String ref) {
        return new Provenance(source, ref, tags, createdBy);
    }

    /**
     * Appends a tag unless already present and stamps {@code createdBy}.
     */
    public Provenance withTag(String tag, String creator) {
        LinkedHashSet<String> merged = new LinkedHashSet<>(tags);
        merged.add(tag);
        return new Provenance(source, sourceRef, List.copyOf(merged), creator);
    }
}
