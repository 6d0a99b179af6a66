package io.mcpmemory.core.store;

import io.mcpmemory.core.config.ConfigDimensionListener;
import io.mcpmemory.core.config.ConfigPaths;
import io.mcpmemory.core.config.ConfigService;
import io.mcpmemory.core.config.model.EmbedderConfig;
import io.mcpmemory.core.config.model.MemoryConfig;
import io.mcpmemory.core.namespace.DimensionDiscoveringEmbedder;
import io.mcpmemory.core.namespace.Embedder;
import io.mcpmemory.core.namespace.Namespace;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires a ready-to-use store from the config file: resolves the embedding dimension,
 * derives the namespace, creates the configured backend and initializes it.
 */
public final class StoreBootstrap {
    private static final Logger LOG = LoggerFactory.getLogger(StoreBootstrap.class);

    static final String DIMENSION_PROBE_TEXT = "dimension probe";

    private final ConfigService configService;

    public StoreBootstrap(ConfigService configService) {
        this.configService = Objects.requireNonNull(configService, "configService must not be null");
    }

    public OpenedStore open(Embedder embedder) throws IOException {
        return open(ConfigPaths.defaultConfigPath(), embedder);
    }

    /**
     * When the config does not know the embedding dimension yet, one probe embedding is
     * made so that the namespace is final before any data is written; the discovered
     * value is saved back to {@code configPath}.
     */
    public OpenedStore open(Path configPath, Embedder embedder) throws IOException {
        MemoryConfig config = configService.load(configPath);
        EmbedderConfig embedderConfig = config.embedder();
        DimensionDiscoveringEmbedder discovering = new DimensionDiscoveringEmbedder(
            embedder,
            embedderConfig.dim(),
            new ConfigDimensionListener(configService, configPath)
        );
        if (discovering.dimension() == 0) {
            discovering.embed(DIMENSION_PROBE_TEXT);
        }
        Namespace namespace = new Namespace(embedderConfig.provider(), embedderConfig.model(), discovering.dimension());

        Path dataDir = ConfigPaths.resolveDataDir(config.paths() == null ? null : config.paths().dataDir());
        Store store = StoreFactory.create(config.store(), dataDir);
        try {
            store.initialize(namespace.toString());
        } catch (IOException | RuntimeException e) {
            try {
                store.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        LOG.info("Opened {} store for namespace {}", config.store().type(), namespace);
        return new OpenedStore(store, namespace, discovering);
    }

    public record OpenedStore(Store store, Namespace namespace, Embedder embedder) implements Closeable {

        @Override
        public void close() throws IOException {
            store.close();
        }
    }
}
