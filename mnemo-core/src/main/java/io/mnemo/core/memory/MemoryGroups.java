package io.mnemo.core.memory;

import io.mnemo.core.atom.AtomType;
import java.util.List;

/**
 * The four built-in memory groups and their fixed mapping onto atom types.
 */
public final class MemoryGroups {
    public static final String PREFERENCES = "preferences";
    public static final String LEARNINGS = "learnings";
    public static final String CONTEXT = "context";
    public static final String INSTRUCTIONS = "instructions";

    public static final List<String> DEFAULTS = List.of(PREFERENCES, LEARNINGS, CONTEXT, INSTRUCTIONS);

    private MemoryGroups() {
    }

    public static boolean isDefault(String group) {
        return group != null && DEFAULTS.contains(group);
    }

    public static String forAtomType(AtomType type) {
        if (type == null) {
            return LEARNINGS;
        }
        return switch (type) {
            case INSTRUCTIONS -> INSTRUCTIONS;
            case PREFERENCE -> PREFERENCES;
            case CONTEXT -> CONTEXT;
            default -> LEARNINGS;
        };
    }

    /**
     * Custom groups and {@code learnings} are stored as {@link AtomType#SEMANTIC}.
     */
    public static AtomType atomTypeFor(String group) {
        if (group == null) {
            return AtomType.SEMANTIC;
        }
        return switch (group) {
            case INSTRUCTIONS -> AtomType.INSTRUCTIONS;
            case PREFERENCES -> AtomType.PREFERENCE;
            case CONTEXT -> AtomType.CONTEXT;
            default -> AtomType.SEMANTIC;
        };
    }
}
