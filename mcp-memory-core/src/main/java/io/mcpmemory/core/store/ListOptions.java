package io.mcpmemory.core.store;

import java.util.List;

public record ListOptions(
    String projectId,
    String groupId,
    List<String> tags,
    int limit
) {
    public static final int DEFAULT_LIMIT = 10;

    public ListOptions {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId must not be empty");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static ListOptions forProject(String projectId) {
        return forProject(projectId, DEFAULT_LIMIT);
    }

    public static ListOptions forProject(String projectId, int limit) {
        return new ListOptions(projectId, null, List.of(), limit);
    }

    public ListOptions withGroupId(String value) {
        return new ListOptions(projectId, value, tags, limit);
    }

    public ListOptions withTags(List<String> value) {
        return new ListOptions(projectId, groupId, value, limit);
    }
}
