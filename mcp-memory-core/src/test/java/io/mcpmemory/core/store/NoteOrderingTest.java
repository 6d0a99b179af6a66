package io.mcpmemory.core.store;

import static org.assertj.core.api.Assertions.assertThat;

import io.mcpmemory.core.model.Note;
import java.util.List;
import org.junit.jupiter.api.Test;

class NoteOrderingTest {

    @Test
    void shouldBreakScoreTiesById() {
        List<SearchResult> results = List.of(
            new SearchResult(Note.of("c", "/p", "global", "c"), 0.5),
            new SearchResult(Note.of("a", "/p", "global", "a"), 0.5),
            new SearchResult(Note.of("b", "/p", "global", "b"), 0.9)
        );

        assertThat(NoteOrdering.topK(results, 2))
            .extracting(result -> result.note().id())
            .containsExactly("b", "a");
    }

    @Test
    void shouldOrderByInstantRatherThanText() {
        Note utc = Note.of("utc", "/p", "global", "x").withCreatedAt("2025-01-01T01:00:00Z");
        Note offset = Note.of("offset", "/p", "global", "x").withCreatedAt("2025-01-01T02:30:00+02:00");
        Note missing = Note.of("missing", "/p", "global", "x");

        assertThat(NoteOrdering.mostRecent(List.of(missing, offset, utc), 10))
            .extracting(Note::id)
            .containsExactly("utc", "offset", "missing");
    }
}
