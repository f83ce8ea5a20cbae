package ch.so.arp.kbdb.search;

import java.util.Arrays;
import java.util.Objects;

/**
 * Row of the {@code embeddings} table, keyed by chunk, model and task.
 */
public record ChunkEmbedding(long chunkId, String model, String task, float[] vector) {

    public ChunkEmbedding {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(task, "task");
        vector = Objects.requireNonNull(vector, "vector").clone();
    }

    @Override
    public float[] vector() {
        return vector.clone();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ChunkEmbedding that
                && chunkId == that.chunkId
                && model.equals(that.model)
                && task.equals(that.task)
                && Arrays.equals(vector, that.vector);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chunkId, model, task) * 31 + Arrays.hashCode(vector);
    }

    @Override
    public String toString() {
        return "ChunkEmbedding[chunkId=" + chunkId + ", model=" + model + ", task=" + task + ", dimensions="
                + vector.length + "]";
    }
}
