package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * @param backend {@code sqlite} or {@code memory}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(String dataDir, String backend) {
    public static final String SQLITE = "sqlite";
    public static final String MEMORY = "memory";

    public static StorageConfig defaults() {
        return new StorageConfig("~/.mnemo/data", SQLITE);
    }

    public boolean inMemory() {
        return MEMORY.equalsIgnoreCase(backend == null ? "" : backend.trim());
    }
}
