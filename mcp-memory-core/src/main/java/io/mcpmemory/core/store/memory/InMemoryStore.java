package io.mcpmemory.core.store.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.mcpmemory.core.model.GlobalConfig;
import io.mcpmemory.core.model.Group;
import io.mcpmemory.core.model.Note;
import io.mcpmemory.core.store.JsonValues;
import io.mcpmemory.core.store.ListOptions;
import io.mcpmemory.core.store.NotFoundException;
import io.mcpmemory.core.store.NotInitializedException;
import io.mcpmemory.core.store.NoteDefaults;
import io.mcpmemory.core.store.NoteFilters;
import io.mcpmemory.core.store.NoteOrdering;
import io.mcpmemory.core.store.SearchOptions;
import io.mcpmemory.core.store.SearchResult;
import io.mcpmemory.core.store.Store;
import io.mcpmemory.core.store.StoreException;
import io.mcpmemory.core.store.VectorMath;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Reference implementation holding everything in process memory. Every value crossing
 * the API is deep-copied in both directions, so callers never share state with the store.
 * Data does not survive {@link #close()}.
 */
public final class InMemoryStore implements Store {
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Entry> notes = new LinkedHashMap<>();
    private final Map<String, GlobalConfig> globals = new LinkedHashMap<>();
    private final Map<String, Group> groups = new LinkedHashMap<>();
    private final JsonValues json;
    private final Clock clock;

    private String namespace;
    private boolean initialized;

    public InMemoryStore() {
        this(Clock.systemUTC());
    }

    public InMemoryStore(Clock clock) {
        this.clock = clock;
        this.json = new JsonValues();
    }

    @Override
    public void initialize(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be empty");
        }
        lock.writeLock().lock();
        try {
            if (initialized && !namespace.equals(this.namespace)) {
                throw new IllegalStateException(
                    "store already bound to namespace " + this.namespace + ", refusing " + namespace
                );
            }
            this.namespace = namespace;
            this.initialized = true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            notes.clear();
            globals.clear();
            groups.clear();
            initialized = false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Note addNote(Note note, float[] embedding) throws IOException {
        Note prepared = NoteDefaults.prepare(note, clock);
        float[] vector = NoteDefaults.requireEmbedding(embedding).clone();
        lock.writeLock().lock();
        try {
            ensureInitialized();
            notes.put(prepared.id(), new Entry(copy(prepared), vector));
            return copy(prepared);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Note get(String id) throws IOException {
        lock.readLock().lock();
        try {
            ensureInitialized();
            Entry entry = notes.get(id);
            if (entry == null) {
                throw new NotFoundException("note not found: " + id);
            }
            return copy(entry.note());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Note update(Note note, float[] embedding) throws IOException {
        Note prepared = NoteDefaults.prepare(note, clock);
        float[] vector = NoteDefaults.requireEmbedding(embedding).clone();
        lock.writeLock().lock();
        try {
            ensureInitialized();
            if (!notes.containsKey(prepared.id())) {
                throw new NotFoundException("note not found: " + prepared.id());
            }
            notes.put(prepared.id(), new Entry(copy(prepared), vector));
            return copy(prepared);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void delete(String id) throws IOException {
        lock.writeLock().lock();
        try {
            ensureInitialized();
            if (notes.remove(id) == null) {
                throw new NotFoundException("note not found: " + id);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<SearchResult> search(float[] query, SearchOptions options) throws IOException {
        lock.readLock().lock();
        try {
            ensureInitialized();
            List<SearchResult> results = new ArrayList<>();
            for (Entry entry : notes.values()) {
                if (!NoteFilters.matches(entry.note(), options)) {
                    continue;
                }
                double score = VectorMath.score(query, entry.embedding());
                results.add(new SearchResult(entry.note(), score));
            }
            List<SearchResult> top = NoteOrdering.topK(results, options.topK());
            List<SearchResult> out = new ArrayList<>(top.size());
            for (SearchResult result : top) {
                out.add(new SearchResult(copy(result.note()), result.score()));
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Note> listRecent(ListOptions options) throws IOException {
        lock.readLock().lock();
        try {
            ensureInitialized();
            List<Note> matching = new ArrayList<>();
            for (Entry entry : notes.values()) {
                if (NoteFilters.matches(entry.note(), options)) {
                    matching.add(entry.note());
                }
            }
            List<Note> out = new ArrayList<>();
            for (Note note : NoteOrdering.mostRecent(matching, options.limit())) {
                out.add(copy(note));
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public GlobalConfig upsertGlobal(GlobalConfig config) throws IOException {
        GlobalConfig prepared = NoteDefaults.prepare(config, clock);
        lock.writeLock().lock();
        try {
            ensureInitialized();
            globals.put(prepared.id(), copy(prepared));
            return copy(prepared);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<GlobalConfig> getGlobal(String projectId, String key) throws IOException {
        lock.readLock().lock();
        try {
            ensureInitialized();
            GlobalConfig config = globals.get(GlobalConfig.deriveId(projectId, key));
            return config == null ? Optional.empty() : Optional.of(copy(config));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public GlobalConfig getGlobalById(String id) throws IOException {
        lock.readLock().lock();
        try {
            ensureInitialized();
            GlobalConfig config = globals.get(id);
            if (config == null) {
                throw new NotFoundException("global config not found: " + id);
            }
            return copy(config);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void deleteGlobalById(String id) throws IOException {
        lock.writeLock().lock();
        try {
            ensureInitialized();
            if (globals.remove(id) == null) {
                throw new NotFoundException("global config not found: " + id);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Group addGroup(Group group) throws IOException {
        group.validate();
        lock.writeLock().lock();
        try {
            ensureInitialized();
            requireUniqueGroupKey(group);
            groups.put(group.id(), group);
            return group;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void requireUniqueGroupKey(Group group) throws StoreException {
        for (Group existing : groups.values()) {
            if (!existing.id().equals(group.id())
                && existing.projectId().equals(group.projectId())
                && existing.groupKey().equals(group.groupKey())) {
                throw new StoreException("group key already exists: " + group.groupKey());
            }
        }
    }

    @Override
    public Group getGroup(String id) throws IOException {
        lock.readLock().lock();
        try {
            ensureInitialized();
            Group group = groups.get(id);
            if (group == null) {
                throw new NotFoundException("group not found: " + id);
            }
            return group;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Group getGroupByKey(String projectId, String groupKey) throws IOException {
        lock.readLock().lock();
        try {
            ensureInitialized();
            for (Group group : groups.values()) {
                if (group.projectId().equals(projectId) && group.groupKey().equals(groupKey)) {
                    return group;
                }
            }
            throw new NotFoundException("group not found: " + projectId + "/" + groupKey);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Group updateGroup(Group group) throws IOException {
        group.validate();
        lock.writeLock().lock();
        try {
            ensureInitialized();
            if (!groups.containsKey(group.id())) {
                throw new NotFoundException("group not found: " + group.id());
            }
            requireUniqueGroupKey(group);
            groups.put(group.id(), group);
            return group;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void deleteGroup(String id) throws IOException {
        lock.writeLock().lock();
        try {
            ensureInitialized();
            if (groups.remove(id) == null) {
                throw new NotFoundException("group not found: " + id);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Group> listGroups(String projectId) throws IOException {
        lock.readLock().lock();
        try {
            ensureInitialized();
            List<Group> out = new ArrayList<>();
            for (Group group : groups.values()) {
                if (group.projectId().equals(projectId)) {
                    out.add(group);
                }
            }
            out.sort(Comparator.comparing(Group::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(Group::id));
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void ensureInitialized() throws NotInitializedException {
        if (!initialized) {
            throw new NotInitializedException();
        }
    }

    private Note copy(Note note) throws StoreException {
        try {
            return json.deepCopy(note);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to copy note " + note.id(), e);
        }
    }

    private GlobalConfig copy(GlobalConfig config) throws StoreException {
        try {
            return json.deepCopy(config);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to copy global config " + config.id(), e);
        }
    }

    private record Entry(Note note, float[] embedding) {
    }
}
