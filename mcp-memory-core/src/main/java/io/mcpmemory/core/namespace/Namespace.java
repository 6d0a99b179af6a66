package io.mcpmemory.core.namespace;

/**
 * Isolation key {@code provider:model:dim}. Two different namespaces address disjoint
 * storage; a dimension of 0 means the embedding width has not been discovered yet.
 */
public record Namespace(String provider, String model, int dimension) {

    public Namespace {
        if (provider == null || provider.isBlank() || provider.contains(":")) {
            throw new IllegalArgumentException("provider must be non-empty and free of ':', got '" + provider + "'");
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model must not be empty");
        }
        if (dimension < 0) {
            throw new IllegalArgumentException("dimension must not be negative, got " + dimension);
        }
    }

    /**
     * Parses {@code provider:model:dim}. The model part may itself contain ':' (as Ollama
     * tags do), so the provider is the first segment and the dimension the last.
     */
    public static Namespace parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("namespace must not be null");
        }
        int first = value.indexOf(':');
        int last = value.lastIndexOf(':');
        if (first < 0 || first == last) {
            throw new IllegalArgumentException("expected 'provider:model:dim', got '" + value + "'");
        }
        int dimension;
        try {
            dimension = Integer.parseInt(value.substring(last + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid dim in namespace '" + value + "'", e);
        }
        return new Namespace(value.substring(0, first), value.substring(first + 1, last), dimension);
    }

    public boolean dimensionKnown() {
        return dimension > 0;
    }

    public Namespace withDimension(int value) {
        return new Namespace(provider, model, value);
    }

    /**
     * Collection-safe form of a namespace string. '_' is doubled and every other character
     * outside {@code [A-Za-z0-9.-]} becomes '_' followed by its four hex digits, so distinct
     * namespaces never share a collection, nor collide with another namespace's suffixed ones.
     */
    public static String collectionName(String namespace) {
        StringBuilder name = new StringBuilder(namespace.length() + 8);
        for (int i = 0; i < namespace.length(); i++) {
            char c = namespace.charAt(i);
            if (c == '_') {
                name.append("__");
            } else if (isCollectionSafe(c)) {
                name.append(c);
            } else {
                name.append('_').append(String.format("%04x", (int) c));
            }
        }
        return name.toString();
    }

    private static boolean isCollectionSafe(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '.' || c == '-';
    }

    @Override
    public String toString() {
        return provider + ":" + model + ":" + dimension;
    }
}
