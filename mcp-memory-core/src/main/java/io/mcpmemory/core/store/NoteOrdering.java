package io.mcpmemory.core.store;

import io.mcpmemory.core.model.Note;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class NoteOrdering {
    private static final Logger LOG = LoggerFactory.getLogger(NoteOrdering.class);

    public static final Comparator<SearchResult> BY_SCORE = Comparator
        .comparingDouble(SearchResult::score).reversed()
        .thenComparing(result -> result.note().id());

    private NoteOrdering() {
    }

    public static List<SearchResult> topK(List<SearchResult> results, int topK) {
        List<SearchResult> sorted = new ArrayList<>(results);
        sorted.sort(BY_SCORE);
        return sorted.size() > topK ? List.copyOf(sorted.subList(0, topK)) : List.copyOf(sorted);
    }

    /**
     * Newest first, ties by id. Notes whose {@code createdAt} is missing or unparsable
     * sort after every dated note.
     */
    public static List<Note> mostRecent(List<Note> notes, int limit) {
        List<Dated> dated = new ArrayList<>(notes.size());
        for (Note note : notes) {
            Optional<Instant> createdAt = Timestamps.parse(note.createdAt());
            if (createdAt.isEmpty() && note.createdAt() != null) {
                LOG.warn("Unparsable createdAt '{}' on note {}, ordering it last", note.createdAt(), note.id());
            }
            dated.add(new Dated(note, createdAt.orElse(null)));
        }
        dated.sort(Comparator
            .comparing(Dated::createdAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(entry -> entry.note().id()));

        List<Note> out = new ArrayList<>(Math.min(limit, dated.size()));
        for (Dated entry : dated) {
            if (out.size() >= limit) {
                break;
            }
            out.add(entry.note());
        }
        return out;
    }

    private record Dated(Note note, Instant createdAt) {
    }
}
