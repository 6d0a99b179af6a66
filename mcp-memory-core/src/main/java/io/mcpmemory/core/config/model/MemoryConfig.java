package io.mcpmemory.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryConfig(
    EmbedderConfig embedder,
    StoreConfig store,
    PathsConfig paths
) {

    public static MemoryConfig defaults() {
        return new MemoryConfig(
            EmbedderConfig.defaults(),
            StoreConfig.defaults(),
            PathsConfig.defaults()
        );
    }

    public MemoryConfig withEmbedder(EmbedderConfig value) {
        return new MemoryConfig(value, store, paths);
    }
}
