package ch.so.arp.kbdb.search;

/**
 * Failure of the document store: connection problems, query timeouts or
 * violated integrity constraints.
 */
public class DocumentStoreException extends KnowledgeBaseException {

    public DocumentStoreException(String message) {
        super(message);
    }

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
