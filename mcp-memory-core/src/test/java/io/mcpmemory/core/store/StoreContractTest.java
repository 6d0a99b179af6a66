package io.mcpmemory.core.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.mcpmemory.core.model.GlobalConfig;
import io.mcpmemory.core.model.Group;
import io.mcpmemory.core.model.Note;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Behavior every {@link Store} backend must share. Subclasses only supply the store.
 */
public abstract class StoreContractTest {
    protected static final String PROJECT = "/p";
    protected static final double TOLERANCE = 1e-5;

    protected Store store;

    protected abstract Store createStore() throws Exception;

    /**
     * Namespace with dimension 3, matching the embeddings used throughout.
     */
    protected String namespace() {
        return "test:model:3";
    }

    @BeforeEach
    public void openStore() throws Exception {
        store = createStore();
        store.initialize(namespace());
    }

    @AfterEach
    public void closeStore() throws Exception {
        if (store != null) {
            store.close();
        }
    }

    @Test
    public void shouldRejectOperationsBeforeInitialize() throws Exception {
        Store fresh = createStore();
        try {
            assertThatThrownBy(() -> fresh.get("n1")).isInstanceOf(NotInitializedException.class);
            assertThatThrownBy(() -> fresh.addNote(Note.of("n1", PROJECT, "global", "hello"), vec(1, 0, 0)))
                .isInstanceOf(NotInitializedException.class);
            assertThatThrownBy(() -> fresh.search(vec(1, 0, 0), SearchOptions.forProject(PROJECT, 5)))
                .isInstanceOf(NotInitializedException.class);
            assertThatThrownBy(() -> fresh.listRecent(ListOptions.forProject(PROJECT, 10)))
                .isInstanceOf(NotInitializedException.class);
            assertThatThrownBy(() -> fresh.upsertGlobal(GlobalConfig.of(PROJECT, "global.x", "v")))
                .isInstanceOf(NotInitializedException.class);
            assertThatThrownBy(() -> fresh.listGroups(PROJECT)).isInstanceOf(NotInitializedException.class);
        } finally {
            fresh.close();
        }
    }

    @Test
    public void shouldKeepDataWhenInitializedTwiceWithSameNamespace() throws Exception {
        store.addNote(Note.of("n1", PROJECT, "global", "hello"), vec(1, 0, 0));

        store.initialize(namespace());

        assertThat(store.get("n1").text()).isEqualTo("hello");
        assertThat(store.listRecent(ListOptions.forProject(PROJECT, 10))).hasSize(1);
    }

    @Test
    public void shouldFillCreatedAtAndDefaultTagsOnAdd() throws Exception {
        Note input = new Note("n1", PROJECT, "global", "Title", "hello", null, "cli", null, null);

        Note stored = store.addNote(input, vec(1, 0, 0));
        Note loaded = store.get("n1");

        assertThat(stored.tags()).isEmpty();
        assertThat(Timestamps.parse(stored.createdAt())).isPresent();
        assertThat(loaded).isEqualTo(input.withTags(List.of()).withCreatedAt(stored.createdAt()));
    }

    @Test
    public void shouldRoundTripOptionalFieldsAndMetadata() throws Exception {
        Map<String, Object> metadata = Map.of(
            "count", 3,
            "ratio", 0.5,
            "flag", true,
            "label", "x",
            "nested", Map.of("items", List.of(1, "two", false))
        );
        Note input = new Note(
            "n1", PROJECT, "feature-1", "Title", "hello", List.of("a", "b"), "editor",
            "2025-01-02T03:04:05Z", metadata
        );

        store.addNote(input, vec(1, 0, 0));

        assertThat(store.get("n1")).isEqualTo(input);
    }

    @Test
    public void shouldReturnSingleMatchWithPerfectScore() throws Exception {
        store.addNote(Note.of("n1", PROJECT, "global", "hello"), vec(1, 0, 0));

        List<SearchResult> results = store.search(vec(1, 0, 0), SearchOptions.forProject(PROJECT, 5));

        assertThat(results).hasSize(1);
        assertThat(results.get(0).note().id()).isEqualTo("n1");
        assertThat(results.get(0).score()).isCloseTo(1.0, within(TOLERANCE));
    }

    @Test
    public void shouldRankByCosineScore() throws Exception {
        store.addNote(Note.of("same", PROJECT, "global", "same"), vec(2, 0, 0));
        store.addNote(Note.of("orthogonal", PROJECT, "global", "orthogonal"), vec(0, 1, 0));
        store.addNote(Note.of("opposite", PROJECT, "global", "opposite"), vec(-1, 0, 0));

        List<SearchResult> results = store.search(vec(1, 0, 0), SearchOptions.forProject(PROJECT, 5));

        assertThat(ids(results)).containsExactly("same", "orthogonal", "opposite");
        assertThat(results.get(0).score()).isCloseTo(1.0, within(TOLERANCE));
        assertThat(results.get(1).score()).isCloseTo(0.5, within(TOLERANCE));
        assertThat(results.get(2).score()).isCloseTo(0.0, within(TOLERANCE));
    }

    @Test
    public void shouldTruncateToTopK() throws Exception {
        store.addNote(Note.of("a", PROJECT, "global", "a"), vec(1, 0, 0));
        store.addNote(Note.of("b", PROJECT, "global", "b"), vec(1, 1, 0));
        store.addNote(Note.of("c", PROJECT, "global", "c"), vec(0, 1, 0));

        List<SearchResult> results = store.search(vec(1, 0, 0), SearchOptions.forProject(PROJECT, 2));

        assertThat(ids(results)).containsExactly("a", "b");
    }

    @Test
    public void shouldNeverReturnNotesFromAnotherProject() throws Exception {
        store.addNote(Note.of("mine", PROJECT, "global", "mine"), vec(0, 1, 0));
        store.addNote(Note.of("theirs", "/other", "global", "theirs"), vec(1, 0, 0));

        assertThat(ids(store.search(vec(1, 0, 0), SearchOptions.forProject(PROJECT, 5)))).containsExactly("mine");
        assertThat(store.listRecent(ListOptions.forProject(PROJECT, 10)))
            .extracting(Note::id)
            .containsExactly("mine");
    }

    @Test
    public void shouldFilterByGroupAndRequireEveryTag() throws Exception {
        store.addNote(note("g1-both", "g1", "2025-01-01T00:00:00Z", "api", "db"), vec(1, 0, 0));
        store.addNote(note("g1-api", "g1", "2025-01-01T00:00:01Z", "api"), vec(1, 0, 0));
        store.addNote(note("g2-both", "g2", "2025-01-01T00:00:02Z", "api", "db"), vec(1, 0, 0));

        SearchOptions options = SearchOptions.forProject(PROJECT, 10).withGroupId("g1").withTags(List.of("api", "db"));
        assertThat(ids(store.search(vec(1, 0, 0), options))).containsExactly("g1-both");

        SearchOptions anyGroup = SearchOptions.forProject(PROJECT, 10).withTags(List.of("db"));
        assertThat(ids(store.search(vec(1, 0, 0), anyGroup))).containsExactlyInAnyOrder("g1-both", "g2-both");
    }

    @Test
    public void shouldMatchTagsCaseSensitively() throws Exception {
        store.addNote(note("n1", "global", "2025-01-01T00:00:00Z", "Go"), vec(1, 0, 0));

        SearchOptions lower = SearchOptions.forProject(PROJECT, 5).withTags(List.of("go"));
        SearchOptions exact = SearchOptions.forProject(PROJECT, 5).withTags(List.of("Go"));

        assertThat(store.search(vec(1, 0, 0), lower)).isEmpty();
        assertThat(ids(store.search(vec(1, 0, 0), exact))).containsExactly("n1");
    }

    @Test
    public void shouldTreatTimeRangeAsHalfOpen() throws Exception {
        store.addNote(note("before", "global", "2025-01-01T09:59:59Z"), vec(1, 0, 0));
        store.addNote(note("at-since", "global", "2025-01-01T10:00:00Z"), vec(1, 0, 0));
        store.addNote(note("inside", "global", "2025-01-01T10:30:00Z"), vec(1, 0, 0));
        store.addNote(note("at-until", "global", "2025-01-01T11:00:00Z"), vec(1, 0, 0));
        store.addNote(note("undated", "global", "not-a-date"), vec(1, 0, 0));

        SearchOptions options = SearchOptions.forProject(PROJECT, 10)
            .withRange(Instant.parse("2025-01-01T10:00:00Z"), Instant.parse("2025-01-01T11:00:00Z"));

        assertThat(ids(store.search(vec(1, 0, 0), options))).containsExactlyInAnyOrder("at-since", "inside");
    }

    @Test
    public void shouldApplyOpenEndedTimeBounds() throws Exception {
        store.addNote(note("old", "global", "2024-06-01T00:00:00Z"), vec(1, 0, 0));
        store.addNote(note("new", "global", "2025-06-01T00:00:00Z"), vec(1, 0, 0));

        SearchOptions sinceOnly = SearchOptions.forProject(PROJECT, 10).withRange(Instant.parse("2025-01-01T00:00:00Z"), null);
        SearchOptions untilOnly = SearchOptions.forProject(PROJECT, 10).withRange(null, Instant.parse("2025-01-01T00:00:00Z"));

        assertThat(ids(store.search(vec(1, 0, 0), sinceOnly))).containsExactly("new");
        assertThat(ids(store.search(vec(1, 0, 0), untilOnly))).containsExactly("old");
    }

    @Test
    public void shouldScoreMismatchedQueryDimensionAsMaximallyDistant() throws Exception {
        store.addNote(Note.of("n1", PROJECT, "global", "hello"), vec(1, 0, 0));

        List<SearchResult> results = store.search(vec(1, 0), SearchOptions.forProject(PROJECT, 5));

        assertThat(ids(results)).containsExactly("n1");
        assertThat(results.get(0).score()).isCloseTo(0.0, within(TOLERANCE));
    }

    @Test
    public void shouldListRecentNewestFirstAcrossGroups() throws Exception {
        store.addNote(note("older", "global", "2025-01-01T00:00:00Z"), vec(1, 0, 0));
        store.addNote(note("newer", "feature-1", "2025-01-02T00:00:00Z"), vec(1, 0, 0));

        assertThat(store.listRecent(ListOptions.forProject(PROJECT, 10)))
            .extracting(Note::id)
            .containsExactly("newer", "older");
        assertThat(store.listRecent(ListOptions.forProject(PROJECT, 10).withGroupId("feature-1")))
            .extracting(Note::id)
            .containsExactly("newer");
    }

    @Test
    public void shouldListUndatedNotesLastAndHonorLimit() throws Exception {
        store.addNote(note("undated", "global", "yesterday"), vec(1, 0, 0));
        store.addNote(note("first", "global", "2025-01-01T00:00:00Z"), vec(1, 0, 0));
        store.addNote(note("second", "global", "2025-01-01T00:00:00+02:00"), vec(1, 0, 0));
        store.addNote(note("third", "global", "2025-03-01T00:00:00Z", "keep"), vec(1, 0, 0));

        assertThat(store.listRecent(ListOptions.forProject(PROJECT, 10)))
            .extracting(Note::id)
            .containsExactly("third", "first", "second", "undated");
        assertThat(store.listRecent(ListOptions.forProject(PROJECT, 2)))
            .extracting(Note::id)
            .containsExactly("third", "first");
        assertThat(store.listRecent(ListOptions.forProject(PROJECT, 10).withTags(List.of("keep"))))
            .extracting(Note::id)
            .containsExactly("third");
    }

    @Test
    public void shouldReplaceNoteAndEmbeddingOnUpdate() throws Exception {
        store.addNote(note("n1", "global", "2025-01-01T00:00:00Z"), vec(1, 0, 0));

        store.update(note("n1", "global", "2025-01-01T00:00:00Z", "edited").withText("changed"), vec(0, 1, 0));

        Note loaded = store.get("n1");
        assertThat(loaded.text()).isEqualTo("changed");
        assertThat(loaded.tags()).containsExactly("edited");
        List<SearchResult> results = store.search(vec(0, 1, 0), SearchOptions.forProject(PROJECT, 5));
        assertThat(results.get(0).score()).isCloseTo(1.0, within(TOLERANCE));
    }

    @Test
    public void shouldOverwriteNoteAddedTwiceWithSameId() throws Exception {
        store.addNote(note("n1", "global", "2025-01-01T00:00:00Z", "first"), vec(1, 0, 0));
        store.addNote(note("n1", "global", "2025-01-02T00:00:00Z", "second").withText("again"), vec(0, 1, 0));

        Note loaded = store.get("n1");
        assertThat(loaded.text()).isEqualTo("again");
        assertThat(loaded.tags()).containsExactly("second");
        List<SearchResult> results = store.search(vec(0, 1, 0), SearchOptions.forProject(PROJECT, 5));
        assertThat(ids(results)).containsExactly("n1");
        assertThat(results.get(0).score()).isCloseTo(1.0, within(TOLERANCE));
        assertThat(store.listRecent(ListOptions.forProject(PROJECT, 5))).extracting(Note::id).containsExactly("n1");
    }

    @Test
    public void shouldRejectEmbeddingWithoutDirection() throws Exception {
        assertThatThrownBy(() -> store.addNote(Note.of("n1", PROJECT, "global", "flat"), vec(0, 0, 0)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.get("n1")).isInstanceOf(NotFoundException.class);

        store.addNote(Note.of("n2", PROJECT, "global", "pointed"), vec(1, 0, 0));
        assertThatThrownBy(() -> store.update(Note.of("n2", PROJECT, "global", "flat"), vec(0, 0, 0)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.get("n2").text()).isEqualTo("pointed");
    }

    @Test
    public void shouldReportMissingNotes() throws Exception {
        assertThatThrownBy(() -> store.get("missing")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.delete("missing")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.update(Note.of("missing", PROJECT, "global", "x"), vec(1, 0, 0)))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    public void shouldDeleteNote() throws Exception {
        store.addNote(Note.of("n1", PROJECT, "global", "hello"), vec(1, 0, 0));

        store.delete("n1");

        assertThatThrownBy(() -> store.get("n1")).isInstanceOf(NotFoundException.class);
        assertThat(store.search(vec(1, 0, 0), SearchOptions.forProject(PROJECT, 5))).isEmpty();
    }

    @Test
    public void shouldKeepLastWriteForGlobalConfig() throws Exception {
        store.upsertGlobal(GlobalConfig.of(PROJECT, "global.x", "v1"));
        GlobalConfig second = store.upsertGlobal(GlobalConfig.of(PROJECT, "global.x", "v2"));

        Optional<GlobalConfig> loaded = store.getGlobal(PROJECT, "global.x");

        assertThat(loaded).isPresent();
        assertThat(loaded.get().value()).isEqualTo("v2");
        assertThat(loaded.get().id()).isEqualTo("global:/p:global.x");
        assertThat(second.id()).isEqualTo(loaded.get().id());
        assertThat(Timestamps.parse(loaded.get().updatedAt())).isPresent();
    }

    @Test
    public void shouldStoreStructuredGlobalValues() throws Exception {
        Map<String, Object> value = Map.of("style", "tabs", "width", 4, "rules", List.of("a", "b"));
        store.upsertGlobal(GlobalConfig.of(PROJECT, GlobalConfig.PROJECT_CONVENTIONS, value));

        assertThat(store.getGlobal(PROJECT, GlobalConfig.PROJECT_CONVENTIONS))
            .get()
            .extracting(GlobalConfig::value)
            .isEqualTo(value);
        assertThat(store.getGlobal("/other", GlobalConfig.PROJECT_CONVENTIONS)).isEmpty();
    }

    @Test
    public void shouldAccessGlobalConfigById() throws Exception {
        GlobalConfig stored = store.upsertGlobal(GlobalConfig.of(PROJECT, "global.x", "v1"));

        assertThat(store.getGlobalById(stored.id()).value()).isEqualTo("v1");

        store.deleteGlobalById(stored.id());

        assertThat(store.getGlobal(PROJECT, "global.x")).isEmpty();
        assertThatThrownBy(() -> store.getGlobalById(stored.id())).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.deleteGlobalById(stored.id())).isInstanceOf(NotFoundException.class);
    }

    @Test
    public void shouldManageGroups() throws Exception {
        Group first = group("g-1", "api", "2025-01-01T00:00:00Z");
        Group second = group("g-2", "db", "2025-01-02T00:00:00Z");
        store.addGroup(second);
        store.addGroup(first);

        assertThat(store.getGroup("g-1")).isEqualTo(first);
        assertThat(store.getGroupByKey(PROJECT, "db")).isEqualTo(second);
        assertThat(store.listGroups(PROJECT)).extracting(Group::id).containsExactly("g-1", "g-2");
        assertThat(store.listGroups("/other")).isEmpty();

        Group renamed = first.withTitle("API work").withDescription("endpoints").withUpdatedAt(Instant.parse("2025-02-01T00:00:00Z"));
        store.updateGroup(renamed);
        assertThat(store.getGroup("g-1")).isEqualTo(renamed);

        store.deleteGroup("g-2");
        assertThatThrownBy(() -> store.getGroup("g-2")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.getGroupByKey(PROJECT, "db")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.deleteGroup("g-2")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.updateGroup(second)).isInstanceOf(NotFoundException.class);
    }

    @Test
    public void shouldRejectDuplicateGroupKeyWithinProject() throws Exception {
        store.addGroup(group("g-1", "api", "2025-01-01T00:00:00Z"));

        assertThatThrownBy(() -> store.addGroup(group("g-2", "api", "2025-01-02T00:00:00Z")))
            .isInstanceOf(StoreException.class);
    }

    @Test
    public void shouldRejectGroupUpdateOntoAnotherGroupsKey() throws Exception {
        store.addGroup(group("g-1", "api", "2025-01-01T00:00:00Z"));
        Group db = store.addGroup(group("g-2", "db", "2025-01-02T00:00:00Z"));

        assertThatThrownBy(() -> store.updateGroup(db.withGroupKey("api")))
            .isInstanceOf(StoreException.class)
            .isNotInstanceOf(NotFoundException.class);

        assertThat(store.getGroup("g-2").groupKey()).isEqualTo("db");
        assertThat(store.getGroupByKey(PROJECT, "api").id()).isEqualTo("g-1");
        assertThat(store.listGroups(PROJECT)).extracting(Group::groupKey).containsExactly("api", "db");
    }

    @Test
    public void shouldHandleConcurrentWriters() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Note>> tasks = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                String id = "n" + i;
                tasks.add(() -> store.addNote(Note.of(id, PROJECT, "global", "text " + id), vec(1, 0, 0)));
            }
            for (Future<Note> future : pool.invokeAll(tasks)) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.listRecent(ListOptions.forProject(PROJECT, 100))).hasSize(20);
    }

    protected static float[] vec(float... values) {
        return values;
    }

    protected static Note note(String id, String groupId, String createdAt, String... tags) {
        return new Note(id, PROJECT, groupId, null, "text of " + id, List.of(tags), null, createdAt, null);
    }

    protected static Group group(String id, String key, String createdAt) {
        Instant at = Instant.parse(createdAt);
        return new Group(id, PROJECT, key, "Group " + key, null, at, at);
    }

    protected static List<String> ids(List<SearchResult> results) {
        List<String> ids = new ArrayList<>();
        for (SearchResult result : results) {
            ids.add(result.note().id());
        }
        return ids;
    }
}
