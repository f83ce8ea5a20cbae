package ch.so.arp.kbdb.search;

import java.util.List;

/**
 * Nearest neighbour access to the stored chunk embeddings.
 */
public interface EmbeddingStore {

    /**
     * Find the chunks closest to the query vector among the embeddings that were
     * computed for the modality's model and task.
     * <p>
     * Results are ordered best first under the modality's metric. Ties are
     * broken by ascending document id and chunk index.
     *
     * @param queryVector the embedded query
     * @param modality    the modality selecting model, task and metric
     * @param limit       the maximum amount of results to return
     * @return the ranked results, empty if nothing is indexed for the modality
     * @throws DocumentStoreException if the store cannot be queried
     */
    List<SearchResult> findNearest(float[] queryVector, Modality modality, int limit);
}
