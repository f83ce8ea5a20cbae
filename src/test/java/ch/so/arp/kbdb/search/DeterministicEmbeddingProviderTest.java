package ch.so.arp.kbdb.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class DeterministicEmbeddingProviderTest {

    private static final EmbeddingStrategy CLUSTERING = new EmbeddingStrategy("nomic-embed-text:v1.5", "clustering: ",
            "");
    private static final EmbeddingStrategy CLASSIFICATION = new EmbeddingStrategy("nomic-embed-text:v1.5",
            "classification: ", "");

    private final DeterministicEmbeddingProvider provider = new DeterministicEmbeddingProvider(768);

    @Test
    void producesStableUnitVectorsOfConfiguredDimension() {
        float[] first = provider.embed("pasta", CLUSTERING);
        float[] second = provider.embed("pasta", CLUSTERING);

        assertThat(first).hasSize(768).containsExactly(second);
        double norm = 0.0d;
        for (float value : first) {
            norm += value * value;
        }
        assertThat(Math.sqrt(norm)).isCloseTo(1.0d, within(1e-4));
    }

    @Test
    void taskPrefixChangesTheVector() {
        assertThat(provider.embed("pasta", CLUSTERING)).isNotEqualTo(provider.embed("pasta", CLASSIFICATION));
    }

    @Test
    void rejectsNonPositiveDimensions() {
        assertThatThrownBy(() -> new DeterministicEmbeddingProvider(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
