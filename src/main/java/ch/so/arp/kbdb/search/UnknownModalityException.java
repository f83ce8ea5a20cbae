package ch.so.arp.kbdb.search;

/**
 * Raised when a search names a modality that is not registered.
 */
public class UnknownModalityException extends KnowledgeBaseException {

    public UnknownModalityException(String modality) {
        super("Unknown modality '" + modality + "'");
    }
}
