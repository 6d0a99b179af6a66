package io.mcpmemory.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Project-scoped key/value setting. {@code value} holds any JSON-compatible value:
 * null, String, Number, Boolean, List or Map.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GlobalConfig(
    String id,
    String projectId,
    String key,
    Object value,
    String updatedAt
) {

    public static final String KEY_PREFIX = "global.";
    public static final String EMBEDDER_PROVIDER = "global.memory.embedder.provider";
    public static final String EMBEDDER_MODEL = "global.memory.embedder.model";
    public static final String GROUP_DEFAULTS = "global.memory.groupDefaults";
    public static final String PROJECT_CONVENTIONS = "global.project.conventions";

    public static GlobalConfig of(String projectId, String key, Object value) {
        return new GlobalConfig(null, projectId, key, value, null);
    }

    /**
     * Stores never trust a caller-supplied id; the identity of a setting is its
     * (projectId, key) pair.
     */
    public static String deriveId(String projectId, String key) {
        return "global:" + projectId + ":" + key;
    }

    public GlobalConfig withId(String value) {
        return new GlobalConfig(value, projectId, key, this.value, updatedAt);
    }

    public GlobalConfig withUpdatedAt(String value) {
        return new GlobalConfig(id, projectId, key, this.value, value);
    }

    public void validate() {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId must not be empty");
        }
        Identifiers.validateGlobalKey(key);
    }
}
