package ch.so.arp.kbdb.search;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * Arguments of a search tool call. {@code top_k} is optional.
 */
public record ToolRequest(String query,
        @JsonProperty("top_k") @JsonDeserialize(using = StrictIntegerDeserializer.class) Integer topK) {
}
