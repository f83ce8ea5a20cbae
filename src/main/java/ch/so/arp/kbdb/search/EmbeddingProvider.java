package ch.so.arp.kbdb.search;

/**
 * Strategy abstraction used to compute embeddings for queries. Implementations
 * can either call a remote embedding API or provide deterministic placeholders
 * that are suited for tests and local development.
 */
public interface EmbeddingProvider {

    /**
     * Create an embedding vector for the provided text. The strategy's prefix
     * and suffix are applied before the text is embedded.
     *
     * @param text     the text to embed
     * @param strategy model and text transform of the modality
     * @return the embedding represented as a float array
     * @throws EmbeddingServiceException if no vector could be obtained
     */
    float[] embed(String text, EmbeddingStrategy strategy);
}
