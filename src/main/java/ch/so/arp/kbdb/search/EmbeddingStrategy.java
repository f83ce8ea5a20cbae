package ch.so.arp.kbdb.search;

import java.util.Objects;

/**
 * Describes how text is embedded for a modality: the model to call and the
 * task prefix and suffix wrapped around the text before it is sent.
 */
public record EmbeddingStrategy(String model, String prefix, String suffix) {

    public EmbeddingStrategy {
        Objects.requireNonNull(model, "model");
        prefix = prefix == null ? "" : prefix;
        suffix = suffix == null ? "" : suffix;
    }

    public String apply(String text) {
        return prefix + text + suffix;
    }
}
