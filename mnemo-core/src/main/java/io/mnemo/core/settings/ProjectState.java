package io.mnemo.core.settings;

import java.util.List;
import java.util.TreeSet;

/**
 * Per-project engine state kept in the settings store.
 *
 * @param customGroups sorted, de-duplicated names of non-default memory groups
 * @param lastConsolidationRunAt epoch millis of the last completed consolidation, 0 when never run
 */
public record ProjectState(List<String> customGroups, long lastConsolidationRunAt) {
    public ProjectState {
        TreeSet<String> sorted = new TreeSet<>();
        if (customGroups != null) {
            for (String group : customGroups) {
                if (group != null && !group.isBlank()) {
                    sorted.add(group.trim());
                }
            }
        }
        customGroups = List.copyOf(sorted);
        lastConsolidationRunAt = Math.max(0L, lastConsolidationRunAt);
    }

    public static ProjectState empty() {
        return new ProjectState(List.of(), 0L);
    }

    public ProjectState withGroup(String group) {
        TreeSet<String> next = new TreeSet<>(customGroups);
        next.add(group);
        return new ProjectState(List.copyOf(next), lastConsolidationRunAt);
    }

    public ProjectState withoutGroup(String group) {
        TreeSet<String> next = new TreeSet<>(customGroups);
        next.remove(group);
        return new ProjectState(List.copyOf(next), lastConsolidationRunAt);
    }

    public ProjectState withLastConsolidationRunAt(long epochMs) {
        return new ProjectState(customGroups, epochMs);
    }
}
