package io.mcpmemory.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreConfig(
    String type,
    String path,
    String url,
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"note_warning_threshold"}) int noteWarningThreshold
) {
    public static final String MEMORY = "memory";
    public static final String SQLITE = "sqlite";
    public static final String QDRANT = "qdrant";

    public static StoreConfig defaults() {
        return new StoreConfig(SQLITE, null, "http://localhost:6333", null, 5000);
    }

    public static StoreConfig ofType(String type) {
        StoreConfig defaults = defaults();
        return new StoreConfig(type, defaults.path(), defaults.url(), defaults.apiKey(), defaults.noteWarningThreshold());
    }

    public StoreConfig withPath(String value) {
        return new StoreConfig(type, value, url, apiKey, noteWarningThreshold);
    }
}
