package io.mnemo.core.settings;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads and saves {@link ProjectState} through the settings key/value store,
 * one key per field, namespaced by project id.
 */
public final class ProjectStateStore {
    private static final Logger LOG = LoggerFactory.getLogger(ProjectStateStore.class);
    static final String CUSTOM_GROUPS_PREFIX = "memory.custom_groups:";
    static final String LAST_CONSOLIDATION_PREFIX = "memory.last_consolidation_run:";
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final SettingsStore settings;
    private final ObjectMapper mapper = new ObjectMapper();

    public ProjectStateStore(SettingsStore settings) {
        this.settings = settings;
    }

    public ProjectState load(String projectId) throws IOException {
        List<String> groups = settings.get(CUSTOM_GROUPS_PREFIX + projectId)
            .map(this::parseGroups)
            .orElse(List.of());
        long lastRun = settings.get(LAST_CONSOLIDATION_PREFIX + projectId)
            .map(this::parseMillis)
            .orElse(0L);
        return new ProjectState(groups, lastRun);
    }

    public void save(String projectId, ProjectState state) throws IOException {
        settings.set(CUSTOM_GROUPS_PREFIX + projectId, mapper.writeValueAsString(state.customGroups()));
        settings.set(LAST_CONSOLIDATION_PREFIX + projectId, Long.toString(state.lastConsolidationRunAt()));
    }

    private List<String> parseGroups(String raw) {
        try {
            return Optional.ofNullable(mapper.readValue(raw, STRING_LIST)).orElse(List.of());
        } catch (IOException e) {
            LOG.debug("Ignoring malformed custom group registry: {}", e.getMessage());
            return List.of();
        }
    }

    private long parseMillis(String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            LOG.debug("Ignoring malformed consolidation timestamp: {}", raw);
            return 0L;
        }
    }
}
