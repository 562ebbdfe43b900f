package io.mnemo.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mnemo.core.config.model.MnemoConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads {@code config.json} layered over {@link MnemoConfig#defaults()}, so a
 * file only needs the keys it changes. A missing or blank file means defaults.
 */
public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public MnemoConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return MnemoConfig.defaults();
        }

        String raw = Files.readString(configPath);
        if (raw.isBlank()) {
            return MnemoConfig.defaults();
        }
        JsonNode existingNode = mapper.readTree(raw);
        if (!existingNode.isObject()) {
            throw new IOException("Config " + configPath + " must hold a JSON object, found " + existingNode.getNodeType());
        }
        JsonNode defaultsNode = mapper.valueToTree(MnemoConfig.defaults());
        return mapper.treeToValue(deepMerge(defaultsNode, existingNode), MnemoConfig.class);
    }

    public void save(Path configPath, MnemoConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    /**
     * Writes the config file, filling in any keys added since it was created, and
     * makes sure the data directory exists.
     */
    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        MnemoConfig config;
        if (created || overwrite) {
            config = MnemoConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);

        Path dataDir = ConfigPaths.resolveDataDir(config.storage().dataDir());
        Files.createDirectories(dataDir);
        return new InitResult(configPath, dataDir, created, overwritten);
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null || override.isNull()) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
