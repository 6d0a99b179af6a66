package io.mcpmemory.core.store.qdrant;

import io.qdrant.client.grpc.Points.PointId;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import static io.qdrant.client.PointIdFactory.id;

/**
 * Qdrant addresses points by unsigned 64-bit integers or UUIDs. String ids are mapped to
 * the first eight bytes of their SHA-256 digest. The mapping only addresses a point; the
 * string id travels in the payload and is what lookups compare against.
 */
final class PointIds {

    private PointIds() {
    }

    static long hash(String id) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(id.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(digest, 0, Long.BYTES).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static PointId pointId(String id) {
        return id(hash(id));
    }
}
