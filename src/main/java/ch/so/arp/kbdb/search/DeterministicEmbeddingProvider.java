package ch.so.arp.kbdb.search;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offline embedding provider. The vector is a unit vector seeded from a hash of
 * the model name and the transformed text, so identical inputs always map to
 * identical vectors and different task prefixes map to different ones. It
 * allows the service to run without an embedding endpoint.
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
    public float[] embed(String text, EmbeddingStrategy strategy) {
        Random random = new Random(seed(strategy.model(), strategy.apply(text)));
        float[] vector = new float[dimensions];
        double norm = 0.0d;
        for (int i = 0; i < vector.length; i++) {
            float value = (random.nextFloat() * 2.0f) - 1.0f;
            vector[i] = value;
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) (vector[i] / norm);
        }
        return vector;
    }

    private long seed(String model, String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(model.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(input.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(digest.digest()).getLong();
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }
}
