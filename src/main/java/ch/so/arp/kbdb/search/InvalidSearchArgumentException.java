package ch.so.arp.kbdb.search;

/**
 * A tool argument is missing, blank or outside its allowed range.
 */
public class InvalidSearchArgumentException extends KnowledgeBaseException {

    public InvalidSearchArgumentException(String message) {
        super(message);
    }
}
