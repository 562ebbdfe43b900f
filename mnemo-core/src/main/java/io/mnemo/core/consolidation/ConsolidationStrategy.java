package io.mnemo.core.consolidation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ConsolidationStrategy {
    AGGRESSIVE("aggressive"),
    BALANCED("balanced"),
    CONSERVATIVE("conservative");

    private final String wireValue;

    ConsolidationStrategy(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ConsolidationStrategy fromWire(String value) {
        if (value == null) {
            return BALANCED;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ConsolidationStrategy strategy : values()) {
            if (strategy.wireValue.equals(normalized)) {
                return strategy;
            }
        }
        return BALANCED;
    }
}
