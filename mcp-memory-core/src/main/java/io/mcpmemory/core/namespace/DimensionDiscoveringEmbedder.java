package io.mcpmemory.core.namespace;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps an {@link Embedder} whose output width may be unknown up front. The first
 * successful embedding fixes the dimension and notifies the listener, at most once for
 * the lifetime of this instance. A configured (non-zero) dimension is never reported.
 */
public final class DimensionDiscoveringEmbedder implements Embedder {
    private static final Logger LOG = LoggerFactory.getLogger(DimensionDiscoveringEmbedder.class);

    private final Embedder delegate;
    private final DimensionListener listener;
    private final AtomicInteger dimension;
    private final AtomicBoolean reported;

    public DimensionDiscoveringEmbedder(Embedder delegate, int knownDimension, DimensionListener listener) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        if (knownDimension < 0) {
            throw new IllegalArgumentException("knownDimension must not be negative");
        }
        this.dimension = new AtomicInteger(knownDimension);
        this.reported = new AtomicBoolean(knownDimension > 0);
    }

    @Override
    public float[] embed(String text) throws IOException {
        float[] vector = delegate.embed(text);
        if (vector == null || vector.length == 0) {
            throw new IOException("embedder returned an empty vector");
        }
        if (!reported.get() && reported.compareAndSet(false, true)) {
            dimension.set(vector.length);
            LOG.info("Discovered embedding dimension {}", vector.length);
            try {
                listener.onDimensionDiscovered(vector.length);
            } catch (IOException | RuntimeException e) {
                LOG.warn("Failed to record discovered embedding dimension {}", vector.length, e);
            }
        }
        return vector;
    }

    @Override
    public int dimension() {
        return dimension.get();
    }
}
