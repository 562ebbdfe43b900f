package io.mnemo.core.atom;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Sensitivity {
    NORMAL("normal"),
    SENSITIVE("sensitive"),
    RESTRICTED("restricted");

    private final String wireValue;

    Sensitivity(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static Sensitivity fromWire(String value) {
        if (value == null) {
            return NORMAL;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Sensitivity sensitivity : values()) {
            if (sensitivity.wireValue.equals(normalized)) {
                return sensitivity;
            }
        }
        return NORMAL;
    }
}
