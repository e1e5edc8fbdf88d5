package com.team.issueintel.service.embedding;

import com.team.issueintel.config.EmbeddingApiConfig;
import com.team.issueintel.util.TextPreprocessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Blocking, failure-absorbing access to the {@link EmbeddingProvider}.
 * Every call is bounded by the embedding timeout; errors, timeouts and empty vectors
 * all come back as {@link Optional#empty()}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EmbeddingGateway {

    private final EmbeddingProvider embeddingProvider;
    private final EmbeddingApiConfig config;

    public Optional<double[]> tryEmbed(String text) {
        String clean = TextPreprocessor.clean(text);
        if (clean.isEmpty()) {
            return Optional.empty();
        }
        try {
            double[] vector = embeddingProvider.embed(clean)
                    .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                    .block();
            if (vector == null || vector.length == 0) {
                log.warn("Embedding provider returned no data");
                return Optional.empty();
            }
            return Optional.of(vector);
        } catch (Exception e) {
            log.warn("Embedding unavailable, degrading: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
