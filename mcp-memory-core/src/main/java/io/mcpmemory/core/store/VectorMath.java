package io.mcpmemory.core.store;

public final class VectorMath {
    public static final double MAX_DISTANCE = 2.0;

    private VectorMath() {
    }

    /**
     * Cosine distance in [0, 2]. Vectors of different length, empty vectors and
     * zero-norm vectors are maximally dissimilar.
     */
    public static double cosineDistance(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length || a.length == 0) {
            return MAX_DISTANCE;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return MAX_DISTANCE;
        }
        double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return clamp(1.0 - similarity, 0.0, MAX_DISTANCE);
    }

    public static double score(float[] query, float[] embedding) {
        return scoreFromDistance(cosineDistance(query, embedding));
    }

    public static double scoreFromDistance(double distance) {
        return 1.0 - distance / MAX_DISTANCE;
    }

    // Similarity in [-1, 1] as reported by cosine-indexed vector databases.
    public static double scoreFromSimilarity(double similarity) {
        return clamp((similarity + 1.0) / 2.0, 0.0, 1.0);
    }

    public static boolean hasZeroNorm(float[] vector) {
        for (float v : vector) {
            if (v != 0.0f) {
                return false;
            }
        }
        return true;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
