package io.mcpmemory.core.model;

import java.util.regex.Pattern;

public final class Identifiers {
    public static final String GLOBAL_GROUP = "global";

    private static final Pattern GROUP_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]+$");
    private static final Pattern GLOBAL_KEY_PATTERN = Pattern.compile("^global\\.[a-zA-Z0-9._-]+$");

    private Identifiers() {
    }

    public static void validateGroupId(String groupId) {
        if (groupId == null || groupId.isEmpty()) {
            throw new IllegalArgumentException("groupId must not be empty");
        }
        if (!GROUP_PATTERN.matcher(groupId).matches()) {
            throw new IllegalArgumentException("groupId must match ^[a-zA-Z0-9_-]+$, got '" + groupId + "'");
        }
    }

    // "global" is addressable as a note group but cannot be registered as a Group.
    public static void validateGroupKeyForCreate(String groupKey) {
        validateGroupId(groupKey);
        if (GLOBAL_GROUP.equals(groupKey)) {
            throw new IllegalArgumentException("groupKey 'global' is reserved");
        }
    }

    public static void validateGlobalKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
        if (!key.startsWith(GlobalConfig.KEY_PREFIX) || key.length() == GlobalConfig.KEY_PREFIX.length()) {
            throw new IllegalArgumentException("key must start with 'global.' followed by a name, got '" + key + "'");
        }
        if (!GLOBAL_KEY_PATTERN.matcher(key).matches()) {
            throw new IllegalArgumentException("key must match ^global\\.[a-zA-Z0-9._-]+$, got '" + key + "'");
        }
    }
}
