package io.mnemo.core.settings;

import java.io.IOException;
import java.util.Optional;

public interface SettingsStore {
    Optional<String> get(String key) throws IOException;

    void set(String key, String value) throws IOException;
}
