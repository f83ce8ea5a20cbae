package ch.so.arp.kbdb.search;

/**
 * Base type of all failures raised while answering a search request. The tool
 * boundary translates any of these into a user facing message.
 */
public abstract class KnowledgeBaseException extends RuntimeException {

    protected KnowledgeBaseException(String message) {
        super(message);
    }

    protected KnowledgeBaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
