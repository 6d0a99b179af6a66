package io.mcpmemory.core.config;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns a user-supplied project directory into the stable project id notes are scoped by.
 */
public final class ProjectPaths {

    private ProjectPaths() {
    }

    /**
     * Expands {@code ~}, makes the path absolute and resolves symlinks. A path that does
     * not exist (or cannot be resolved) falls back to its absolute, normalized form.
     */
    public static String canonicalize(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            throw new IllegalArgumentException("project path must not be empty");
        }
        Path absolute = ConfigPaths.expandHome(rawPath.trim()).toAbsolutePath().normalize();
        try {
            return absolute.toRealPath().toString();
        } catch (IOException e) {
            return absolute.toString();
        }
    }
}
