package ch.so.arp.kbdb.search;

/**
 * Row of the {@code document_chunks} table. {@code index} is the position of
 * the chunk within its document and is unique per document.
 */
public record DocumentChunk(long id, long documentId, int index, String content) {
}
