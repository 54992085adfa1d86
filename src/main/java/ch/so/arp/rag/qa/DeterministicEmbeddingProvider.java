package ch.so.arp.rag.qa;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.SplittableRandom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives a unit vector from the SHA-256 digest of the text. Equal texts map to
 * equal vectors, so an exact question lookup always finds its own document,
 * while unrelated texts land at pseudo-random distances.
 */
class DeterministicEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeterministicEmbeddingProvider.class);

    private final int dimensions;

    DeterministicEmbeddingProvider(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
        LOGGER.info("Using deterministic embeddings with {} dimensions", dimensions);
    }

    @Override
    public float[] embed(String text) {
        SplittableRandom random = new SplittableRandom(seed(text == null ? "" : text));
        float[] vector = new float[dimensions];
        double squares = 0.0d;
        for (int i = 0; i < dimensions; i++) {
            vector[i] = (float) random.nextDouble(-1.0d, 1.0d);
            squares += vector[i] * vector[i];
        }
        float norm = (float) Math.sqrt(squares);
        if (norm > 0.0f) {
            for (int i = 0; i < dimensions; i++) {
                vector[i] /= norm;
            }
        }
        return vector;
    }

    private static long seed(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(digest).getLong();
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }
}
