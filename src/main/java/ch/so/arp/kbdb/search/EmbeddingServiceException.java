package ch.so.arp.kbdb.search;

/**
 * The embedding service could not be reached, timed out or answered with
 * something other than a vector of the expected dimensionality.
 */
public class EmbeddingServiceException extends KnowledgeBaseException {

    public EmbeddingServiceException(String message) {
        super(message);
    }

    public EmbeddingServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
