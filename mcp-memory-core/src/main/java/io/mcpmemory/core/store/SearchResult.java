package io.mcpmemory.core.store;

import io.mcpmemory.core.model.Note;

/**
 * A matched note and its similarity score in [0, 1]; 1.0 means same direction,
 * 0.5 orthogonal, 0.0 opposite.
 */
public record SearchResult(Note note, double score) {
}
