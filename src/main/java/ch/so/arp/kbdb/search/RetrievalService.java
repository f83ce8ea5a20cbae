package ch.so.arp.kbdb.search;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one modality scoped nearest neighbour search: resolve the modality,
 * validate the arguments, embed the query and ask the store for the closest
 * chunks. Every failure propagates to the caller; nothing is retried and no
 * partial result is returned.
 */
public class RetrievalService {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetrievalService.class);

    private final ModalityRegistry registry;
    private final EmbeddingProvider embeddingProvider;
    private final EmbeddingStore embeddingStore;
    private final int defaultTopK;
    private final int maxTopK;

    public RetrievalService(ModalityRegistry registry, EmbeddingProvider embeddingProvider,
            EmbeddingStore embeddingStore, int defaultTopK, int maxTopK) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.embeddingStore = Objects.requireNonNull(embeddingStore, "embeddingStore");
        if (defaultTopK <= 0 || defaultTopK > maxTopK) {
            throw new IllegalArgumentException("defaultTopK must be between 1 and " + maxTopK);
        }
        this.defaultTopK = defaultTopK;
        this.maxTopK = maxTopK;
    }

    /**
     * Search the chunks indexed for a modality.
     *
     * @param modalityName registered modality name
     * @param query        free text query
     * @param topK         amount of results, {@code null} for the default
     * @return results ordered best first, possibly empty
     * @throws UnknownModalityException       if the modality is not registered
     * @throws InvalidSearchArgumentException if query or {@code topK} is invalid
     * @throws EmbeddingServiceException      if the query cannot be embedded
     * @throws DocumentStoreException         if the store query fails
     */
    public List<SearchResult> search(String modalityName, String query, Integer topK) {
        Modality modality = registry.resolve(modalityName);
        int limit = validateTopK(topK);
        if (query == null || query.isBlank()) {
            throw new InvalidSearchArgumentException("query must not be blank");
        }

        LOGGER.debug("Searching modality {} (model={}, metric={}, top_k={}) for '{}'", modality.name(),
                modality.strategy().model(), modality.metric(), limit, query);

        float[] queryVector = embeddingProvider.embed(query, modality.strategy());
        List<SearchResult> results = embeddingStore.findNearest(queryVector, modality, limit);

        LOGGER.debug("Modality {} returned {} results", modality.name(), results.size());
        return results;
    }

    private int validateTopK(Integer topK) {
        if (topK == null) {
            return defaultTopK;
        }
        if (topK <= 0 || topK > maxTopK) {
            throw new InvalidSearchArgumentException("top_k must be between 1 and " + maxTopK + " but was " + topK);
        }
        return topK;
    }
}
