package io.mcpmemory.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;

/**
 * A memory note scoped by project and group.
 *
 * <p>{@code title}, {@code source}, {@code createdAt} and {@code metadata} are nullable.
 * {@code createdAt} is kept as the ISO-8601 text it was written with so that an
 * unparsable value survives a round trip through any backend.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Note(
    String id,
    String projectId,
    String groupId,
    String title,
    String text,
    List<String> tags,
    String source,
    String createdAt,
    Map<String, Object> metadata
) {

    public static Note of(String id, String projectId, String groupId, String text) {
        return new Note(id, projectId, groupId, null, text, List.of(), null, null, null);
    }

    public Note withCreatedAt(String value) {
        return new Note(id, projectId, groupId, title, text, tags, source, value, metadata);
    }

    public Note withTags(List<String> value) {
        return new Note(id, projectId, groupId, title, text, value, source, createdAt, metadata);
    }

    public Note withTitle(String value) {
        return new Note(id, projectId, groupId, value, text, tags, source, createdAt, metadata);
    }

    public Note withText(String value) {
        return new Note(id, projectId, groupId, title, value, tags, source, createdAt, metadata);
    }

    public Note withGroupId(String value) {
        return new Note(id, projectId, value, title, text, tags, source, createdAt, metadata);
    }

    public Note withSource(String value) {
        return new Note(id, projectId, groupId, title, text, tags, value, createdAt, metadata);
    }

    public Note withMetadata(Map<String, Object> value) {
        return new Note(id, projectId, groupId, title, text, tags, source, createdAt, value);
    }

    public List<String> tagsOrEmpty() {
        return tags == null ? List.of() : tags;
    }

    public void validate() {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be empty");
        }
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId must not be empty");
        }
        Identifiers.validateGroupId(groupId);
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("text must not be empty");
        }
    }
}
