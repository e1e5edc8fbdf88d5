package com.team.issueintel.service.embedding;

import com.team.issueintel.config.EmbeddingApiConfig;
import com.team.issueintel.exception.ProviderUnavailableException;
import io.github.bucket4j.Bucket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Calls an OpenAI-compatible embeddings endpoint with WebClient.
 */
@Service
@Slf4j
public class EmbeddingApiService implements EmbeddingProvider {

    private static final String PROVIDER = "Embedding API";

    private final EmbeddingApiConfig config;
    private final WebClient webClient;
    private final Bucket rateLimiter;

    public EmbeddingApiService(EmbeddingApiConfig config,
                               @Qualifier("embeddingWebClient") WebClient webClient,
                               @Qualifier("embeddingApiRateLimiter") Bucket rateLimiter) {
        this.config = config;
        this.webClient = webClient;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public Mono<double[]> embed(String text) {
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            return Mono.error(new ProviderUnavailableException(PROVIDER, "API key not configured"));
        }
        if (!rateLimiter.tryConsume(1)) {
            log.warn("Embedding API rate limit exceeded. Skipping request.");
            return Mono.error(new ProviderUnavailableException(PROVIDER, "rate limit exceeded"));
        }

        Map<String, Object> requestBody = Map.of(
                "model", config.getModel(),
                "input", text
        );

        return webClient.post()
                .uri("/embeddings")
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .map(this::extractEmbedding)
                .doOnSuccess(vector -> log.debug("Embedding received ({} dimensions)", vector.length))
                .doOnError(error -> log.warn("Embedding API call failed: {}", error.getMessage()));
    }

    @SuppressWarnings("unchecked")
    private double[] extractEmbedding(Map<String, Object> response) {
        List<Map<String, Object>> data = (List<Map<String, Object>>) response.get("data");
        if (data == null || data.isEmpty()) {
            throw new ProviderUnavailableException(PROVIDER, "empty response");
        }
        List<Number> values = (List<Number>) data.get(0).get("embedding");
        if (values == null || values.isEmpty()) {
            throw new ProviderUnavailableException(PROVIDER, "no embedding in response");
        }
        double[] vector = new double[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i).doubleValue();
        }
        return vector;
    }
}
