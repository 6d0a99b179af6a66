package io.mcpmemory.core.store;

import io.mcpmemory.core.model.Note;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Predicates shared by the backends that filter client-side. The remote backend
 * expresses the same rules as server-side conditions.
 */
public final class NoteFilters {

    private NoteFilters() {
    }

    public static boolean matches(Note note, SearchOptions options) {
        return matchesScope(note, options.projectId(), options.groupId(), options.tags())
            && withinRange(note, options.since(), options.until());
    }

    public static boolean matches(Note note, ListOptions options) {
        return matchesScope(note, options.projectId(), options.groupId(), options.tags());
    }

    public static boolean matchesScope(Note note, String projectId, String groupId, List<String> tags) {
        if (!projectId.equals(note.projectId())) {
            return false;
        }
        if (groupId != null && !groupId.equals(note.groupId())) {
            return false;
        }
        return containsAllTags(note.tagsOrEmpty(), tags);
    }

    public static boolean containsAllTags(List<String> noteTags, List<String> required) {
        if (required == null || required.isEmpty()) {
            return true;
        }
        Set<String> present = new HashSet<>(noteTags);
        return present.containsAll(required);
    }

    public static boolean withinRange(Note note, Instant since, Instant until) {
        if (since == null && until == null) {
            return true;
        }
        Optional<Instant> createdAt = Timestamps.parse(note.createdAt());
        if (createdAt.isEmpty()) {
            return false;
        }
        Instant at = createdAt.get();
        if (since != null && at.isBefore(since)) {
            return false;
        }
        return until == null || at.isBefore(until);
    }
}
