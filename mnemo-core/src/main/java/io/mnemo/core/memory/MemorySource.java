package io.mnemo.core.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum MemorySource {
    AUTO("auto"),
    MANUAL("manual");

    private final String wireValue;

    MemorySource(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static MemorySource fromWire(String value) {
        if (value != null && AUTO.wireValue.equals(value.trim().toLowerCase(Locale.ROOT))) {
            return AUTO;
        }
        return MANUAL;
    }
}
