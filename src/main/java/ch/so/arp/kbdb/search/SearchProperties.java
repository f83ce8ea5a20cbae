package ch.so.arp.kbdb.search;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Settings of the retrieval core, including the static modality table.
 */
@Validated
@ConfigurationProperties(prefix = "kbdb.search")
public class SearchProperties {

    /**
     * Number of results returned when a caller does not ask for a specific amount.
     */
    @Positive
    private int defaultTopK = 3;

    /**
     * Largest accepted {@code top_k}; larger requests are rejected.
     */
    @Positive
    private int maxTopK = 50;

    /**
     * Dimensionality of every stored and query embedding.
     */
    @Positive
    private int dimensions = 768;

    /**
     * Timeout applied to each nearest neighbour query.
     */
    @NotNull
    private Duration queryTimeout = Duration.ofSeconds(10);

    @Valid
    @NotEmpty
    private List<ModalityDefinition> modalities = new ArrayList<>();

    public int getDefaultTopK() {
        return defaultTopK;
    }

    public void setDefaultTopK(int defaultTopK) {
        this.defaultTopK = defaultTopK;
    }

    public int getMaxTopK() {
        return maxTopK;
    }

    public void setMaxTopK(int maxTopK) {
        this.maxTopK = maxTopK;
    }

    public int getDimensions() {
        return dimensions;
    }

    public void setDimensions(int dimensions) {
        this.dimensions = dimensions;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public void setQueryTimeout(Duration queryTimeout) {
        this.queryTimeout = queryTimeout;
    }

    public List<ModalityDefinition> getModalities() {
        return modalities;
    }

    public void setModalities(List<ModalityDefinition> modalities) {
        this.modalities = modalities;
    }

    /**
     * Builds the immutable modality list from the bound definitions.
     */
    List<Modality> toModalities() {
        return modalities.stream().map(ModalityDefinition::toModality).toList();
    }

    /**
     * One entry of the modality table.
     */
    public static class ModalityDefinition {

        @NotBlank
        private String name;

        private String description;

        /**
         * Embedding model identifier sent to the embedding service and stored
         * alongside the chunk embeddings.
         */
        @NotBlank
        private String model;

        private String prefix = "";

        private String suffix = "";

        @NotNull
        private DistanceMetric metric = DistanceMetric.COSINE;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public String getSuffix() {
            return suffix;
        }

        public void setSuffix(String suffix) {
            this.suffix = suffix;
        }

        public DistanceMetric getMetric() {
            return metric;
        }

        public void setMetric(DistanceMetric metric) {
            this.metric = metric;
        }

        Modality toModality() {
            return new Modality(name, description, new EmbeddingStrategy(model, prefix, suffix), metric);
        }
    }
}
