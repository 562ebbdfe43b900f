package io.mnemo.core.feedback;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum FeedbackType {
    POSITIVE("positive"),
    NEGATIVE("negative"),
    PIN("pin"),
    UNPIN("unpin"),
    HIDE("hide"),
    REPORT_CONFLICT("report_conflict");

    private final String wireValue;

    FeedbackType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static FeedbackType fromWire(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (FeedbackType type : values()) {
            if (type.wireValue.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown feedback type: " + value);
    }
}
