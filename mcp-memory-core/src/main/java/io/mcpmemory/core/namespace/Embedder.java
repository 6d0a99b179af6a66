package io.mcpmemory.core.namespace;

import java.io.IOException;

/**
 * Produces one fixed-length vector per text. Stores never call an embedder themselves;
 * callers embed notes and queries before handing vectors to a store.
 */
public interface Embedder {

    float[] embed(String text) throws IOException;

    /**
     * The vector length this embedder produces, or 0 while it is still unknown.
     */
    int dimension();
}
