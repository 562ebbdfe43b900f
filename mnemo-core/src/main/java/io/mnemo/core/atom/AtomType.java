package io.mnemo.core.atom;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AtomType {
    INSTRUCTIONS("instructions"),
    SEMANTIC("semantic"),
    EPISODIC("episodic"),
    PROCEDURAL("procedural"),
    PREFERENCE("preference"),
    CONTEXT("context");

    private final String wireValue;

    AtomType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Unknown or missing values fall back to {@link #SEMANTIC}.
     */
    @JsonCreator
    public static AtomType fromWire(String value) {
        if (value == null) {
            return SEMANTIC;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AtomType type : values()) {
            if (type.wireValue.equals(normalized)) {
                return type;
            }
        }
        return SEMANTIC;
    }
}
