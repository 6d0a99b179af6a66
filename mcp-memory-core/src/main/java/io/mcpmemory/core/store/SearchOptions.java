package io.mcpmemory.core.store;

import java.time.Instant;
import java.util.List;

/**
 * Filters and bound for {@link Store#search}. {@code groupId}, {@code since} and
 * {@code until} are optional; the time range is half-open, {@code since <= createdAt < until}.
 */
public record SearchOptions(
    String projectId,
    String groupId,
    List<String> tags,
    Instant since,
    Instant until,
    int topK
) {
    public static final int DEFAULT_TOP_K = 5;

    public SearchOptions {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId must not be empty");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive, got " + topK);
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static SearchOptions forProject(String projectId) {
        return forProject(projectId, DEFAULT_TOP_K);
    }

    public static SearchOptions forProject(String projectId, int topK) {
        return new SearchOptions(projectId, null, List.of(), null, null, topK);
    }

    public SearchOptions withGroupId(String value) {
        return new SearchOptions(projectId, value, tags, since, until, topK);
    }

    public SearchOptions withTags(List<String> value) {
        return new SearchOptions(projectId, groupId, value, since, until, topK);
    }

    public SearchOptions withRange(Instant from, Instant to) {
        return new SearchOptions(projectId, groupId, tags, from, to, topK);
    }

    public boolean hasTimeRange() {
        return since != null || until != null;
    }
}
