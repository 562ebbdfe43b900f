package io.mnemo.core.config;

import java.nio.file.Path;
import java.util.Map;

public final class ConfigPaths {
    public static final String DATA_DIR_ENV = "MNEMO_DATA_DIR";
    public static final String DATABASE_FILE = "memory.db";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".mnemo", "config.json");
    }

    public static Path resolveDataDir(String rawPath) {
        return resolveDataDir(rawPath, System.getenv());
    }

    /**
     * {@value #DATA_DIR_ENV} in {@code env} takes precedence over the configured path.
     */
    public static Path resolveDataDir(String rawPath, Map<String, String> env) {
        String override = env.get(DATA_DIR_ENV);
        String effective = override == null || override.isBlank() ? rawPath : override;
        if (effective == null || effective.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".mnemo", "data");
        }
        if (effective.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(effective.substring(2));
        }
        return Path.of(effective);
    }
}
