package io.mcpmemory.core.store;

import io.mcpmemory.core.config.ConfigPaths;
import io.mcpmemory.core.config.model.StoreConfig;
import io.mcpmemory.core.store.memory.InMemoryStore;
import io.mcpmemory.core.store.qdrant.QdrantStore;
import io.mcpmemory.core.store.sqlite.SqliteStore;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;

public final class StoreFactory {
    static final String SQLITE_FILE_NAME = "memory.db";

    private StoreFactory() {
    }

    /**
     * Builds the backend named by {@code config.type()}. The returned store still needs
     * {@link Store#initialize(String)}.
     *
     * @throws ConnectionFailedException when a remote backend cannot be reached
     */
    public static Store create(StoreConfig config, Path dataDir) throws IOException {
        String type = config.type() == null ? StoreConfig.SQLITE : config.type().trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case StoreConfig.MEMORY:
                return new InMemoryStore();
            case StoreConfig.SQLITE:
                return new SqliteStore(sqlitePath(config, dataDir), warningThreshold(config), Clock.systemUTC());
            case StoreConfig.QDRANT:
                return QdrantStore.connect(config.url(), config.apiKey());
            default:
                throw new IllegalArgumentException("unknown store type '" + config.type() + "'");
        }
    }

    static Path sqlitePath(StoreConfig config, Path dataDir) {
        if (config.path() != null && !config.path().isBlank()) {
            return ConfigPaths.expandHome(config.path());
        }
        return dataDir.resolve(SQLITE_FILE_NAME);
    }

    private static int warningThreshold(StoreConfig config) {
        return config.noteWarningThreshold() > 0
            ? config.noteWarningThreshold()
            : SqliteStore.DEFAULT_NOTE_WARNING_THRESHOLD;
    }
}
