package io.mcpmemory.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Embedding provider settings. {@code dim} is 0 until the first embedding call
 * reports the model's output width.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbedderConfig(
    String provider,
    String model,
    @JsonAlias({"dimension"}) int dim,
    @JsonAlias({"base_url"}) String baseUrl
) {

    public static EmbedderConfig defaults() {
        return new EmbedderConfig("openai", "text-embedding-3-small", 0, null);
    }

    public EmbedderConfig withDim(int value) {
        return new EmbedderConfig(provider, model, value, baseUrl);
    }
}
