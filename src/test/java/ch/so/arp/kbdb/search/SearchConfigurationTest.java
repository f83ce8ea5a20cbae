package ch.so.arp.kbdb.search;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import javax.sql.DataSource;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

class SearchConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(SearchConfiguration.class, InfrastructureConfiguration.class)
            .withPropertyValues(
                    "kbdb.search.modalities[0].name=semantic",
                    "kbdb.search.modalities[0].description=Search based on semantic similarity",
                    "kbdb.search.modalities[0].model=nomic-embed-text:v1.5",
                    "kbdb.search.modalities[0].prefix=clustering:",
                    "kbdb.search.modalities[1].name=similar_code",
                    "kbdb.search.modalities[1].model=hamidakach/nomic-embed-text-v1.5-GGUF",
                    "kbdb.search.modalities[1].metric=inner_product");

    @Test
    void usesOfflineComponentsByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(EmbeddingProvider.class);
            assertThat(context).getBean(EmbeddingProvider.class).isInstanceOf(DeterministicEmbeddingProvider.class);
            assertThat(context).hasSingleBean(EmbeddingStore.class);
            assertThat(context).getBean(EmbeddingStore.class).isInstanceOf(InMemoryEmbeddingStore.class);
            assertThat(context).hasSingleBean(SearchTools.class);

            SearchTools tools = context.getBean(SearchTools.class);
            assertThat(tools.tools()).extracting(ToolDescriptor::name)
                    .containsExactly("search_semantic", "search_similar_code");
            assertThat(tools.invoke("search_semantic", "pasta", null)).isEqualTo(ResultFormatter.NO_RESULTS);
        });
    }

    @Test
    void bindsModalityTable() {
        contextRunner.run(context -> {
            ModalityRegistry registry = context.getBean(ModalityRegistry.class);

            Modality semantic = registry.resolve("semantic");
            assertThat(semantic.strategy().model()).isEqualTo("nomic-embed-text:v1.5");
            assertThat(semantic.strategy().prefix()).isEqualTo("clustering:");
            assertThat(semantic.metric()).isEqualTo(DistanceMetric.COSINE);
            assertThat(registry.resolve("similar_code").metric()).isEqualTo(DistanceMetric.INNER_PRODUCT);

            SearchProperties properties = context.getBean(SearchProperties.class);
            assertThat(properties.getDefaultTopK()).isEqualTo(3);
            assertThat(properties.getDimensions()).isEqualTo(768);
            assertThat(properties.getQueryTimeout()).isEqualTo(Duration.ofSeconds(10));
        });
    }

    @Test
    void createsRealBeansWhenMocksDisabled() {
        contextRunner
                .withPropertyValues(
                        "kbdb.search.mock-embeddings=false",
                        "kbdb.search.mock-store=false",
                        "kbdb.embedding.api-key=test-key",
                        "kbdb.embedding.base-url=https://example.com/v1",
                        "kbdb.embedding.read-timeout=3s")
                .run(context -> {
                    assertThat(context).hasSingleBean(EmbeddingProvider.class);
                    assertThat(context).getBean(EmbeddingProvider.class).isInstanceOf(OpenAiEmbeddingProvider.class);
                    EmbeddingServiceProperties properties = context.getBean(EmbeddingServiceProperties.class);
                    assertThat(properties.getApiKey()).isEqualTo("test-key");
                    assertThat(properties.getBaseUrl()).isEqualTo("https://example.com/v1");
                    assertThat(properties.getReadTimeout()).isEqualTo(Duration.ofSeconds(3));

                    assertThat(context).hasSingleBean(EmbeddingStore.class);
                    assertThat(context).getBean(EmbeddingStore.class).isInstanceOf(PostgresEmbeddingStore.class);
                });
    }

    @Test
    void fallsBackToEnvironmentForEmbeddingCredentials() {
        contextRunner
                .withPropertyValues(
                        "kbdb.search.mock-embeddings=false",
                        "RM_OPENAI_API_KEY=env-key",
                        "RM_OPENAI_ENDPOINT=http://localhost:11434/v1")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    EmbeddingServiceProperties properties = context.getBean(EmbeddingServiceProperties.class);
                    assertThat(properties.getApiKey()).isEqualTo("env-key");
                    assertThat(properties.getBaseUrl()).isEqualTo("http://localhost:11434/v1");
                });
    }

    @Test
    void failsWithoutApiKeyWhenRealEmbeddingsRequested() {
        contextRunner
                .withPropertyValues("kbdb.search.mock-embeddings=false")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void rejectsDuplicateModalityNames() {
        contextRunner
                .withPropertyValues(
                        "kbdb.search.modalities[1].name=semantic")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void rejectsUnknownMetric() {
        contextRunner
                .withPropertyValues("kbdb.search.modalities[0].metric=manhattan")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void rejectsEmptyModalityTable() {
        new ApplicationContextRunner()
                .withUserConfiguration(SearchConfiguration.class, InfrastructureConfiguration.class)
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    static class InfrastructureConfiguration {

        @Bean
        DataSource dataSource() {
            DriverManagerDataSource dataSource = new DriverManagerDataSource();
            dataSource.setDriverClassName("org.h2.Driver");
            dataSource.setUrl("jdbc:h2:mem:test;MODE=PostgreSQL");
            dataSource.setUsername("sa");
            dataSource.setPassword("");
            return dataSource;
        }
    }
}
