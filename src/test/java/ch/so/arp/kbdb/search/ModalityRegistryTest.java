package ch.so.arp.kbdb.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

class ModalityRegistryTest {

    private static final Modality QA = new Modality("qa", "Question answering",
            new EmbeddingStrategy("nomic-embed-text:v1.5", "search_query: ", ""), DistanceMetric.COSINE);
    private static final Modality CODE = new Modality("similar_code", "Similar code",
            new EmbeddingStrategy("code-model", "clustering: ", ""), DistanceMetric.INNER_PRODUCT);

    private final ModalityRegistry registry = new ModalityRegistry(List.of(QA, CODE));

    @Test
    void resolvesRegisteredModalitiesStably() {
        Modality first = registry.resolve("qa");
        Modality second = registry.resolve("qa");

        assertThat(first).isSameAs(second).isEqualTo(QA);
        assertThat(first.task()).isEqualTo("qa");
        assertThat(first.strategy().apply("what is pgvector?")).isEqualTo("search_query: what is pgvector?");
        assertThat(registry.resolve("similar_code").metric()).isEqualTo(DistanceMetric.INNER_PRODUCT);
    }

    @Test
    void failsForUnknownModality() {
        assertThatThrownBy(() -> registry.resolve("poetry"))
                .isInstanceOf(UnknownModalityException.class)
                .hasMessageContaining("poetry");
        assertThatThrownBy(() -> registry.resolve(null)).isInstanceOf(UnknownModalityException.class);
    }

    @Test
    void keepsRegistrationOrderAndIsReadOnly() {
        assertThat(registry.all()).containsExactly(QA, CODE);
        assertThatThrownBy(() -> registry.all().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void rejectsDuplicateNames() {
        Modality otherQa = new Modality("qa", "", new EmbeddingStrategy("other", "", ""), DistanceMetric.L2);

        assertThatThrownBy(() -> new ModalityRegistry(List.of(QA, otherQa)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("qa");
    }

    @Test
    void rejectsEmptyConfiguration() {
        assertThatThrownBy(() -> new ModalityRegistry(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
