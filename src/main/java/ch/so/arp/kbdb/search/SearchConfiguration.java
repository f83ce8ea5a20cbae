package ch.so.arp.kbdb.search;

import javax.sql.DataSource;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * Central configuration wiring the retrieval core together. It exposes toggles
 * that decide whether the offline or the real embedding service and store are
 * used.
 */
@Configuration
@EnableConfigurationProperties({ SearchProperties.class, EmbeddingServiceProperties.class })
public class SearchConfiguration {

    @Bean
    public ModalityRegistry modalityRegistry(SearchProperties properties) {
        return new ModalityRegistry(properties.toModalities());
    }

    @Bean
    @ConditionalOnProperty(name = "kbdb.search.mock-embeddings", havingValue = "true", matchIfMissing = true)
    public EmbeddingProvider deterministicEmbeddingProvider(SearchProperties properties) {
        return new DeterministicEmbeddingProvider(properties.getDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "kbdb.search.mock-embeddings", havingValue = "false")
    public EmbeddingProvider openAiEmbeddingProvider(EmbeddingServiceProperties embeddingProperties,
            SearchProperties properties) {
        return new OpenAiEmbeddingProvider(embeddingProperties, properties.getDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "kbdb.search.mock-store", havingValue = "true", matchIfMissing = true)
    public EmbeddingStore inMemoryEmbeddingStore(SearchProperties properties) {
        return new InMemoryEmbeddingStore(properties.getDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "kbdb.search.mock-store", havingValue = "false")
    public EmbeddingStore postgresEmbeddingStore(DataSource dataSource, SearchProperties properties) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout((int) Math.max(1L, properties.getQueryTimeout().toSeconds()));
        return new PostgresEmbeddingStore(JdbcClient.create(jdbcTemplate));
    }

    @Bean
    @ConditionalOnMissingBean
    public ResultFormatter resultFormatter() {
        return new ResultFormatter();
    }

    @Bean
    public RetrievalService retrievalService(ModalityRegistry registry, EmbeddingProvider embeddingProvider,
            EmbeddingStore embeddingStore, SearchProperties properties) {
        return new RetrievalService(registry, embeddingProvider, embeddingStore, properties.getDefaultTopK(),
                properties.getMaxTopK());
    }

    @Bean
    public SearchTools searchTools(ModalityRegistry registry, RetrievalService retrievalService,
            ResultFormatter resultFormatter) {
        return new SearchTools(registry, retrievalService, resultFormatter);
    }
}
