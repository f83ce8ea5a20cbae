package ch.so.arp.kbdb.search;

/**
 * One ranked hit of a modality search: the matching chunk together with the
 * document it belongs to. {@code score} is the natural value of the modality's
 * metric (a distance for cosine and L2, the inner product otherwise).
 */
public record SearchResult(
        long documentId,
        String documentName,
        int chunkIndex,
        String content,
        double score) {
}
