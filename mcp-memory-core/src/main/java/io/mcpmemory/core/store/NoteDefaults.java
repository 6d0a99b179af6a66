package io.mcpmemory.core.store;

import io.mcpmemory.core.model.GlobalConfig;
import io.mcpmemory.core.model.Note;
import java.time.Clock;
import java.util.List;

/**
 * Write-side defaults every backend applies before persisting.
 */
public final class NoteDefaults {

    private NoteDefaults() {
    }

    public static Note prepare(Note note, Clock clock) {
        if (note == null) {
            throw new IllegalArgumentException("note must not be null");
        }
        note.validate();
        Note prepared = note;
        if (prepared.createdAt() == null || prepared.createdAt().isBlank()) {
            prepared = prepared.withCreatedAt(Timestamps.now(clock));
        }
        if (prepared.tags() == null) {
            prepared = prepared.withTags(List.of());
        }
        return prepared;
    }

    public static GlobalConfig prepare(GlobalConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        config.validate();
        return config
            .withId(GlobalConfig.deriveId(config.projectId(), config.key()))
            .withUpdatedAt(Timestamps.now(clock));
    }

    /**
     * A stored vector without direction has no cosine similarity to anything.
     */
    public static float[] requireEmbedding(float[] embedding) {
        if (embedding == null) {
            throw new IllegalArgumentException("embedding must not be null");
        }
        if (VectorMath.hasZeroNorm(embedding)) {
            throw new IllegalArgumentException("embedding must have a non-zero norm");
        }
        return embedding;
    }
}
