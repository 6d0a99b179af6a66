package io.mcpmemory.core.store.sqlite;

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
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-file SQLite store. Every row carries its namespace; searches load the project's
 * rows and score them in process, so cost grows linearly with the number of notes.
 */
public final class SqliteStore implements Store {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteStore.class);

    public static final int DEFAULT_NOTE_WARNING_THRESHOLD = 5000;

    private static final String NOTE_COLUMNS =
        "id, project_id, group_id, title, text, tags, source, created_at, metadata";

    private final String jdbcUrl;
    private final int noteWarningThreshold;
    private final Clock clock;
    private final JsonValues json = new JsonValues();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicBoolean thresholdWarned = new AtomicBoolean();

    private String namespace;
    private boolean initialized;

    public SqliteStore(Path dbPath) throws IOException {
        this(dbPath, DEFAULT_NOTE_WARNING_THRESHOLD, Clock.systemUTC());
    }

    public SqliteStore(Path dbPath, int noteWarningThreshold, Clock clock) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Path parent = dbPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.noteWarningThreshold = noteWarningThreshold;
        this.clock = clock;
    }

    @Override
    public void initialize(String namespace) throws IOException {
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
            try (Connection connection = openConnection();
                 Statement statement = connection.createStatement()) {
                for (String ddl : Schema.STATEMENTS) {
                    statement.execute(ddl);
                }
            } catch (SQLException e) {
                throw new StoreException("Failed to initialize SQLite store", e);
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
            initialized = false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Note addNote(Note note, float[] embedding) throws IOException {
        Note prepared = NoteDefaults.prepare(note, clock);
        byte[] blob = EmbeddingCodec.encode(NoteDefaults.requireEmbedding(embedding));
        lock.writeLock().lock();
        try {
            ensureInitialized();
            String sql = """
                INSERT INTO notes (id, namespace, project_id, group_id, title, text, tags, source, created_at, metadata, embedding)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(namespace, id) DO UPDATE SET
                    project_id = excluded.project_id,
                    group_id = excluded.group_id,
                    title = excluded.title,
                    text = excluded.text,
                    tags = excluded.tags,
                    source = excluded.source,
                    created_at = excluded.created_at,
                    metadata = excluded.metadata,
                    embedding = excluded.embedding
                """;
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, prepared.id());
                statement.setString(2, namespace);
                statement.setString(3, prepared.projectId());
                statement.setString(4, prepared.groupId());
                statement.setString(5, prepared.title());
                statement.setString(6, prepared.text());
                statement.setString(7, json.write(prepared.tags()));
                statement.setString(8, prepared.source());
                statement.setString(9, prepared.createdAt());
                statement.setString(10, prepared.metadata() == null ? null : json.write(prepared.metadata()));
                statement.setBytes(11, blob);
                statement.executeUpdate();
                warnIfLarge(connection);
            } catch (SQLException | JsonProcessingException e) {
                throw new StoreException("Failed to add note " + prepared.id(), e);
            }
            return prepared;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Note get(String id) throws IOException {
        lock.readLock().lock();
        try {
            ensureInitialized();
            String sql = "SELECT " + NOTE_COLUMNS + " FROM notes WHERE namespace = ? AND id = ?";
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, namespace);
                statement.setString(2, id);
                try (ResultSet resultSet = statement.executeQuery()) {
                    if (!resultSet.next()) {
                        throw new NotFoundException("note not found: " + id);
                    }
                    return readNote(resultSet);
                }
            } catch (SQLException | JsonProcessingException e) {
                throw new StoreException("Failed to get note " + id, e);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Note update(Note note, float[] embedding) throws IOException {
        Note prepared = NoteDefaults.prepare(note, clock);
        byte[] blob = EmbeddingCodec.encode(NoteDefaults.requireEmbedding(embedding));
        lock.writeLock().lock();
        try {
            ensureInitialized();
            String sql = """
                UPDATE notes
                SET project_id = ?, group_id = ?, title = ?, text = ?, tags = ?, source = ?,
                    created_at = ?, metadata = ?, embedding = ?
                WHERE namespace = ? AND id = ?
                """;
            int updated;
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, prepared.projectId());
                statement.setString(2, prepared.groupId());
                statement.setString(3, prepared.title());
                statement.setString(4, prepared.text());
                statement.setString(5, json.write(prepared.tags()));
                statement.setString(6, prepared.source());
                statement.setString(7, prepared.createdAt());
                statement.setString(8, prepared.metadata() == null ? null : json.write(prepared.metadata()));
                statement.setBytes(9, blob);
                statement.setString(10, namespace);
                statement.setString(11, prepared.id());
                updated = statement.executeUpdate();
            } catch (SQLException | JsonProcessingException e) {
                throw new StoreException("Failed to update note " + prepared.id(), e);
            }
            if (updated == 0) {
                throw new NotFoundException("note not found: " + prepared.id());
            }
            return prepared;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void delete(String id) throws IOException {
        lock.writeLock().lock();
        try {
            ensureInitialized();
            if (deleteRow("DELETE FROM notes WHERE namespace = ? AND id = ?", id, "note") == 0) {
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
            try (Connection connection = openConnection();
                 PreparedStatement statement = scopedQuery(connection, NOTE_COLUMNS + ", embedding",
                     options.projectId(), options.groupId());
                 ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    Note note = readNote(resultSet);
                    if (!NoteFilters.matches(note, options)) {
                        continue;
                    }
                    float[] embedding = EmbeddingCodec.decode(resultSet.getBytes("embedding"));
                    results.add(new SearchResult(note, VectorMath.score(query, embedding)));
                }
            } catch (SQLException | JsonProcessingException e) {
                throw new StoreException("Failed to search notes", e);
            }
            return NoteOrdering.topK(results, options.topK());
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
            try (Connection connection = openConnection();
                 PreparedStatement statement = scopedQuery(connection, NOTE_COLUMNS,
                     options.projectId(), options.groupId());
                 ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    Note note = readNote(resultSet);
                    if (NoteFilters.matches(note, options)) {
                        matching.add(note);
                    }
                }
            } catch (SQLException | JsonProcessingException e) {
                throw new StoreException("Failed to list recent notes", e);
            }
            return NoteOrdering.mostRecent(matching, options.limit());
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
            String sql = """
                INSERT INTO global_configs (id, namespace, project_id, key, value, updated_at)
                VALUES (?, ?, ?, ?, ?, ?)
                ON CONFLICT(namespace, project_id, key) DO UPDATE SET
                    id = excluded.id,
                    value = excluded.value,
                    updated_at = excluded.updated_at
                """;
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, prepared.id());
                statement.setString(2, namespace);
                statement.setString(3, prepared.projectId());
                statement.setString(4, prepared.key());
                statement.setString(5, json.write(prepared.value()));
                statement.setString(6, prepared.updatedAt());
                statement.executeUpdate();
            } catch (SQLException | JsonProcessingException e) {
                throw new StoreException("Failed to upsert global config " + prepared.key(), e);
            }
            return prepared;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<GlobalConfig> getGlobal(String projectId, String key) throws IOException {
        lock.readLock().lock();
        try {
            ensureInitialized();
            String sql = """
                SELECT id, project_id, key, value, updated_at
                FROM global_configs
                WHERE namespace = ? AND project_id = ? AND key = ?
                """;
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, namespace);
                statement.setString(2, projectId);
                statement.setString(3, key);
                try (ResultSet resultSet = statement.executeQuery()) {
                    return resultSet.next() ? Optional.of(readGlobal(resultSet)) : Optional.empty();
                }
            } catch (SQLException | JsonProcessingException e) {
                throw new StoreException("Failed to get global config " + key, e);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public GlobalConfig getGlobalById(String id) throws IOException {
        lock.readLock().lock();
        try {
            ensureInitialized();
            String sql = """
                SELECT id, project_id, key, value, updated_at
                FROM global_configs
                WHERE namespace = ? AND id = ?
                """;
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, namespace);
                statement.setString(2, id);
                try (ResultSet resultSet = statement.executeQuery()) {
                    if (!resultSet.next()) {
                        throw new NotFoundException("global config not found: " + id);
                    }
                    return readGlobal(resultSet);
                }
            } catch (SQLException | JsonProcessingException e) {
                throw new StoreException("Failed to get global config " + id, e);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void deleteGlobalById(String id) throws IOException {
        lock.writeLock().lock();
        try {
            ensureInitialized();
            if (deleteRow("DELETE FROM global_configs WHERE namespace = ? AND id = ?", id, "global config") == 0) {
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
            String sql = """
                INSERT INTO note_groups (id, namespace, project_id, group_key, title, description, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(namespace, id) DO UPDATE SET
                    project_id = excluded.project_id,
                    group_key = excluded.group_key,
                    title = excluded.title,
                    description = excluded.description,
                    created_at = excluded.created_at,
                    updated_at = excluded.updated_at
                """;
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, group.id());
                statement.setString(2, namespace);
                bindGroup(statement, 3, group);
                statement.executeUpdate();
            } catch (SQLException e) {
                throw new StoreException("Failed to add group " + group.groupKey(), e);
            }
            return group;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Group getGroup(String id) throws IOException {
        lock.readLock().lock();
        try {
            ensureInitialized();
            List<Group> found = queryGroups("namespace = ? AND id = ?", namespace, id);
            if (found.isEmpty()) {
                throw new NotFoundException("group not found: " + id);
            }
            return found.get(0);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Group getGroupByKey(String projectId, String groupKey) throws IOException {
        lock.readLock().lock();
        try {
            ensureInitialized();
            List<Group> found = queryGroups(
                "namespace = ? AND project_id = ? AND group_key = ?", namespace, projectId, groupKey
            );
            if (found.isEmpty()) {
                throw new NotFoundException("group not found: " + projectId + "/" + groupKey);
            }
            return found.get(0);
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
            String sql = """
                UPDATE note_groups
                SET project_id = ?, group_key = ?, title = ?, description = ?, created_at = ?, updated_at = ?
                WHERE namespace = ? AND id = ?
                """;
            int updated;
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement(sql)) {
                bindGroup(statement, 1, group);
                statement.setString(7, namespace);
                statement.setString(8, group.id());
                updated = statement.executeUpdate();
            } catch (SQLException e) {
                throw new StoreException("Failed to update group " + group.id(), e);
            }
            if (updated == 0) {
                throw new NotFoundException("group not found: " + group.id());
            }
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
            if (deleteRow("DELETE FROM note_groups WHERE namespace = ? AND id = ?", id, "group") == 0) {
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
            List<Group> groups = queryGroups("namespace = ? AND project_id = ?", namespace, projectId);
            groups.sort(Comparator.comparing(Group::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(Group::id));
            return groups;
        } finally {
            lock.readLock().unlock();
        }
    }

    int countNotes() throws IOException {
        lock.readLock().lock();
        try {
            ensureInitialized();
            try (Connection connection = openConnection()) {
                return countNotes(connection);
            } catch (SQLException e) {
                throw new StoreException("Failed to count notes", e);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    boolean noteCountWarningLogged() {
        return thresholdWarned.get();
    }

    private void warnIfLarge(Connection connection) throws SQLException {
        if (thresholdWarned.get()) {
            return;
        }
        int count = countNotes(connection);
        if (count >= noteWarningThreshold && thresholdWarned.compareAndSet(false, true)) {
            LOG.warn(
                "Namespace {} holds {} notes (threshold {}); every search scans all rows, "
                    + "consider the qdrant store for collections of this size",
                namespace, count, noteWarningThreshold
            );
        }
    }

    private int countNotes(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT COUNT(*) FROM notes WHERE namespace = ?")) {
            statement.setString(1, namespace);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? resultSet.getInt(1) : 0;
            }
        }
    }

    private PreparedStatement scopedQuery(Connection connection, String columns, String projectId, String groupId)
        throws SQLException {
        String sql = "SELECT " + columns + " FROM notes WHERE namespace = ? AND project_id = ?"
            + (groupId == null ? "" : " AND group_id = ?");
        PreparedStatement statement = connection.prepareStatement(sql);
        statement.setString(1, namespace);
        statement.setString(2, projectId);
        if (groupId != null) {
            statement.setString(3, groupId);
        }
        return statement;
    }

    private int deleteRow(String sql, String id, String kind) throws StoreException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, namespace);
            statement.setString(2, id);
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to delete " + kind + " " + id, e);
        }
    }

    private List<Group> queryGroups(String where, String... args) throws StoreException {
        String sql = "SELECT id, project_id, group_key, title, description, created_at, updated_at"
            + " FROM note_groups WHERE " + where;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) {
                statement.setString(i + 1, args[i]);
            }
            List<Group> groups = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    groups.add(new Group(
                        resultSet.getString("id"),
                        resultSet.getString("project_id"),
                        resultSet.getString("group_key"),
                        resultSet.getString("title"),
                        resultSet.getString("description"),
                        parseInstant(resultSet.getString("created_at")),
                        parseInstant(resultSet.getString("updated_at"))
                    ));
                }
            }
            return groups;
        } catch (SQLException e) {
            throw new StoreException("Failed to query groups", e);
        }
    }

    private void bindGroup(PreparedStatement statement, int start, Group group) throws SQLException {
        statement.setString(start, group.projectId());
        statement.setString(start + 1, group.groupKey());
        statement.setString(start + 2, group.title());
        statement.setString(start + 3, group.description());
        statement.setString(start + 4, group.createdAt() == null ? null : group.createdAt().toString());
        statement.setString(start + 5, group.updatedAt() == null ? null : group.updatedAt().toString());
    }

    private Note readNote(ResultSet resultSet) throws SQLException, JsonProcessingException {
        return new Note(
            resultSet.getString("id"),
            resultSet.getString("project_id"),
            resultSet.getString("group_id"),
            resultSet.getString("title"),
            resultSet.getString("text"),
            json.readTags(resultSet.getString("tags")),
            resultSet.getString("source"),
            resultSet.getString("created_at"),
            json.readMap(resultSet.getString("metadata"))
        );
    }

    private GlobalConfig readGlobal(ResultSet resultSet) throws SQLException, JsonProcessingException {
        return new GlobalConfig(
            resultSet.getString("id"),
            resultSet.getString("project_id"),
            resultSet.getString("key"),
            json.readValue(resultSet.getString("value")),
            resultSet.getString("updated_at")
        );
    }

    private static Instant parseInstant(String value) {
        return value == null ? null : Instant.parse(value);
    }

    private void ensureInitialized() throws NotInitializedException {
        if (!initialized) {
            throw new NotInitializedException();
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
            statement.execute("PRAGMA busy_timeout=5000;");
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
        return connection;
    }
}
