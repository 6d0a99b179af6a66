package io.mcpmemory.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Group(
    String id,
    String projectId,
    String groupKey,
    String title,
    String description,
    Instant createdAt,
    Instant updatedAt
) {

    public Group withGroupKey(String value) {
        return new Group(id, projectId, value, title, description, createdAt, updatedAt);
    }

    public Group withTitle(String value) {
        return new Group(id, projectId, groupKey, value, description, createdAt, updatedAt);
    }

    public Group withDescription(String value) {
        return new Group(id, projectId, groupKey, title, value, createdAt, updatedAt);
    }

    public Group withUpdatedAt(Instant value) {
        return new Group(id, projectId, groupKey, title, description, createdAt, value);
    }

    public void validate() {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be empty");
        }
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId must not be empty");
        }
        Identifiers.validateGroupKeyForCreate(groupKey);
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title must not be empty");
        }
    }
}
