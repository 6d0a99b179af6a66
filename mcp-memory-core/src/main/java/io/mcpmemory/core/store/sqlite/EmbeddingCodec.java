package io.mcpmemory.core.store.sqlite;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Embeddings are stored as packed little-endian IEEE-754 32-bit floats, four bytes per
 * component.
 */
final class EmbeddingCodec {

    private EmbeddingCodec() {
    }

    static byte[] encode(float[] embedding) {
        ByteBuffer buffer = ByteBuffer.allocate(embedding.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float value : embedding) {
            buffer.putFloat(value);
        }
        return buffer.array();
    }

    static float[] decode(byte[] data) {
        if (data == null || data.length == 0) {
            return new float[0];
        }
        ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        float[] embedding = new float[data.length / Float.BYTES];
        for (int i = 0; i < embedding.length; i++) {
            embedding[i] = buffer.getFloat();
        }
        return embedding;
    }
}
