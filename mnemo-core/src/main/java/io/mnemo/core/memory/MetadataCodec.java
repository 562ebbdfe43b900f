package io.mnemo.core.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Versioned, reversible encoding of {@link MemoryMetadata} into the free-form
 * {@code provenance.sourceRef} string: {@code mnemo-meta:v1:<base64url(json)>}.
 */
public final class MetadataCodec {
    public static final String PREFIX = "mnemo-meta:v1:";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MetadataCodec() {
    }

    public static String encode(MemoryMetadata metadata) {
        MemoryMetadata safe = metadata == null ? MemoryMetadata.empty() : metadata;
        try {
            byte[] json = MAPPER.writeValueAsBytes(safe);
            return PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode memory metadata", e);
        }
    }

    /**
     * Never throws: anything that is not a well-formed v1 blob decodes to
     * {@link MemoryMetadata#empty()}.
     */
    public static MemoryMetadata decode(String sourceRef) {
        if (sourceRef == null || !sourceRef.startsWith(PREFIX)) {
            return MemoryMetadata.empty();
        }
        try {
            byte[] json = Base64.getUrlDecoder().decode(sourceRef.substring(PREFIX.length()));
            MemoryMetadata decoded = MAPPER.readValue(new String(json, StandardCharsets.UTF_8), MemoryMetadata.class);
            return decoded == null ? MemoryMetadata.empty() : decoded;
        } catch (Exception e) {
            return MemoryMetadata.empty();
        }
    }

    public static boolean isEncoded(String sourceRef) {
        return sourceRef != null && sourceRef.startsWith(PREFIX);
    }
}
