package ch.so.arp.kbdb.search;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Connection settings of the OpenAI compatible embedding service. Key and
 * endpoint fall back to the {@code RM_OPENAI_API_KEY} and
 * {@code RM_OPENAI_ENDPOINT} environment variables.
 */
@ConfigurationProperties(prefix = "kbdb.embedding")
public class EmbeddingServiceProperties implements EnvironmentAware {

    static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    /**
     * API key sent as bearer token.
     */
    private String apiKey;

    /**
     * Base URL of the service; {@code /embeddings} is appended.
     */
    private String baseUrl;

    /**
     * Maximum time to establish the connection.
     */
    private Duration connectTimeout = Duration.ofSeconds(5);

    /**
     * Maximum time to wait for the response.
     */
    private Duration readTimeout = Duration.ofSeconds(30);

    private Environment environment;

    public String getApiKey() {
        if (StringUtils.hasText(apiKey)) {
            return apiKey;
        }
        return environment != null ? environment.getProperty("RM_OPENAI_API_KEY") : null;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        if (StringUtils.hasText(baseUrl)) {
            return baseUrl;
        }
        String fromEnvironment = environment != null ? environment.getProperty("RM_OPENAI_ENDPOINT") : null;
        return StringUtils.hasText(fromEnvironment) ? fromEnvironment : DEFAULT_BASE_URL;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    @Override
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }
}
