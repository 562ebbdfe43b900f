package io.mnemo.core.atom;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ProvenanceSource {
    USER("user"),
    ASSISTANT("assistant"),
    TOOL("tool"),
    IMPORT("import"),
    LEGACY("legacy");

    private final String wireValue;

    ProvenanceSource(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ProvenanceSource fromWire(String value) {
        if (value == null) {
            return ASSISTANT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ProvenanceSource source : values()) {
            if (source.wireValue.equals(normalized)) {
                return source;
            }
        }
        return ASSISTANT;
    }
}
