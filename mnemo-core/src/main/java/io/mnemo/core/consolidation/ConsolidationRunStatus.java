package io.mnemo.core.consolidation;

import java.util.Locale;

public enum ConsolidationRunStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConsolidationRunStatus fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
