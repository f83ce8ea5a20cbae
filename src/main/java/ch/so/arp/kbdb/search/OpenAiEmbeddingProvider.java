package ch.so.arp.kbdb.search;

import java.net.http.HttpClient;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@link EmbeddingProvider} calling an OpenAI compatible {@code /embeddings}
 * endpoint. Every call is a fresh request; nothing is cached or retried.
 */
class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);

    private final RestClient restClient;
    private final int dimensions;

    OpenAiEmbeddingProvider(EmbeddingServiceProperties properties, int dimensions) {
        this(createRestClient(properties), dimensions);
        LOGGER.info("Using embedding service at {}", properties.getBaseUrl());
    }

    OpenAiEmbeddingProvider(RestClient restClient, int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.dimensions = dimensions;
    }

    @Override
    public float[] embed(String text, EmbeddingStrategy strategy) {
        EmbeddingRequest request = new EmbeddingRequest(strategy.model(), strategy.apply(text));
        EmbeddingResponse response;
        try {
            response = restClient.post()
                    .uri("/embeddings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(EmbeddingResponse.class);
        } catch (RestClientResponseException ex) {
            throw new EmbeddingServiceException("Embedding service answered with status "
                    + ex.getStatusCode().value() + " for model " + strategy.model(), ex);
        } catch (RestClientException ex) {
            throw new EmbeddingServiceException("Embedding service call failed: " + ex.getMessage(), ex);
        }
        return toVector(response, strategy.model());
    }

    private float[] toVector(EmbeddingResponse response, String model) {
        if (response == null || response.data() == null || response.data().isEmpty()
                || response.data().get(0).embedding() == null) {
            throw new EmbeddingServiceException("Embedding service returned no vector for model " + model);
        }
        List<Float> values = response.data().get(0).embedding();
        if (values.size() != dimensions) {
            throw new EmbeddingServiceException("Embedding service returned " + values.size()
                    + " dimensions for model " + model + ", expected " + dimensions);
        }
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i);
        }
        LOGGER.debug("Embedded query with model {} ({} dimensions)", model, vector.length);
        return vector;
    }

    private static RestClient createRestClient(EmbeddingServiceProperties properties) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'kbdb.embedding.api-key' must be provided when mock embeddings are disabled");
        }
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.getReadTimeout());
        return RestClient.builder()
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    private record EmbeddingRequest(String model, String input) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbeddingResponse(List<EmbeddingData> data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbeddingData(List<Float> embedding) {
    }
}
