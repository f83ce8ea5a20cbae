package ch.so.arp.kbdb.search;

import java.util.Objects;

/**
 * A named search strategy. Stored embeddings are tagged with the strategy's
 * model and with the modality's task, which is the modality name itself.
 */
public record Modality(String name, String description, EmbeddingStrategy strategy, DistanceMetric metric) {

    public Modality {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(metric, "metric");
        description = description == null ? "" : description;
    }

    public String task() {
        return name;
    }
}
