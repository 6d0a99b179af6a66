package io.mcpmemory.core.store;

import io.mcpmemory.core.model.GlobalConfig;
import io.mcpmemory.core.model.Group;
import io.mcpmemory.core.model.Note;
import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Namespace-scoped persistence for notes, global settings and groups.
 *
 * <p>Every implementation must be safe for concurrent use and must behave identically
 * for the same inputs. Failures surface as {@link StoreException}; the conditions a
 * caller is expected to branch on are the subclasses {@link NotFoundException},
 * {@link NotInitializedException} and {@link ConnectionFailedException}.
 *
 * <p>Every operation other than {@link #initialize(String)} and {@link #close()} throws
 * {@link NotInitializedException} until {@code initialize} has succeeded, and again
 * after {@code close}.
 */
public interface Store extends Closeable {

    /**
     * Binds the store to a namespace, creating the backing tables or collections when
     * they do not exist yet. Calling it again with the same namespace keeps existing data.
     */
    void initialize(String namespace) throws IOException;

    /**
     * Stores a note. A missing {@code createdAt} is set to the current UTC time and
     * missing tags are stored as an empty list. An existing note with the same id is
     * replaced.
     *
     * @return the note as stored
     */
    Note addNote(Note note, float[] embedding) throws IOException;

    Note get(String id) throws IOException;

    /**
     * Replaces an existing note and its embedding wholesale.
     *
     * @throws NotFoundException when no note has {@code note.id()}
     */
    Note update(Note note, float[] embedding) throws IOException;

    void delete(String id) throws IOException;

    /**
     * Scores every note matching the filters against {@code query} and returns the best
     * {@code topK}, highest score first. Equal scores are ordered by note id.
     */
    List<SearchResult> search(float[] query, SearchOptions options) throws IOException;

    /**
     * Returns matching notes newest first; notes without a usable {@code createdAt}
     * come last.
     */
    List<Note> listRecent(ListOptions options) throws IOException;

    /**
     * Inserts or replaces the setting for (projectId, key). The id is always derived
     * from that pair and {@code updatedAt} is always set to the current time.
     *
     * @return the setting as stored
     */
    GlobalConfig upsertGlobal(GlobalConfig config) throws IOException;

    Optional<GlobalConfig> getGlobal(String projectId, String key) throws IOException;

    GlobalConfig getGlobalById(String id) throws IOException;

    void deleteGlobalById(String id) throws IOException;

    Group addGroup(Group group) throws IOException;

    Group getGroup(String id) throws IOException;

    Group getGroupByKey(String projectId, String groupKey) throws IOException;

    Group updateGroup(Group group) throws IOException;

    void deleteGroup(String id) throws IOException;

    List<Group> listGroups(String projectId) throws IOException;
}
