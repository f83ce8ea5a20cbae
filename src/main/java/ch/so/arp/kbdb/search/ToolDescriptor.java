package ch.so.arp.kbdb.search;

/**
 * Public description of one callable search tool.
 */
public record ToolDescriptor(String name, String description, String modality) {
}
