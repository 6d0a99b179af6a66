package io.mcpmemory.core.config;

import io.mcpmemory.core.namespace.DimensionListener;
import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists a discovered embedding dimension into the config file.
 */
public final class ConfigDimensionListener implements DimensionListener {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigDimensionListener.class);

    private final ConfigService configService;
    private final Path configPath;

    public ConfigDimensionListener(ConfigService configService, Path configPath) {
        this.configService = configService;
        this.configPath = configPath;
    }

    @Override
    public void onDimensionDiscovered(int dimension) throws IOException {
        configService.updateDimension(configPath, dimension);
        LOG.info("Saved embedding dimension {} to {}", dimension, configPath);
    }
}
