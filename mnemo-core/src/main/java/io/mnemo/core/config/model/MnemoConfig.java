package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MnemoConfig(
    StorageConfig storage,
    RetrievalConfig retrieval,
    ConsolidationConfig consolidation
) {

    public static MnemoConfig defaults() {
        return new MnemoConfig(
            StorageConfig.defaults(),
            RetrievalConfig.defaults(),
            ConsolidationConfig.defaults()
        );
    }
}
