package ch.so.arp.kbdb.search;

/**
 * Row of the {@code documents} table.
 */
public record Document(long id, String name, String content) {
}
