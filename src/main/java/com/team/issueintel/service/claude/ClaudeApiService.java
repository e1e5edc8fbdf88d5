package com.team.issueintel.service.claude;

import com.team.issueintel.config.ClaudeApiConfig;
import com.team.issueintel.exception.ProviderUnavailableException;
import io.github.bucket4j.Bucket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Service for calling Claude API via Anthropic's Messages API.
 * Uses WebClient for non-blocking HTTP calls with rate limiting.
 */
@Service
@Slf4j
public class ClaudeApiService implements GenerativeContentProvider {

    private static final String ANTHROPIC_VERSION = "2023-06-01";
    private static final String PROVIDER = "Claude API";

    static final String SYSTEM_PROMPT = "You are an expert incident report writer for fitness and wellness brands. "
            + "You write clear, professional, and actionable incident reports that help stakeholders "
            + "understand the situation and next steps.";

    private final ClaudeApiConfig config;
    private final Bucket rateLimiter;
    private final WebClient webClient;

    public ClaudeApiService(ClaudeApiConfig config,
                            @Qualifier("claudeApiRateLimiter") Bucket rateLimiter) {
        this.config = config;
        this.rateLimiter = rateLimiter;
        this.webClient = WebClient.builder()
                .baseUrl(config.getBaseUrl())
                .defaultHeader("x-api-key", config.getApiKey() != null ? config.getApiKey() : "")
                .defaultHeader("anthropic-version", ANTHROPIC_VERSION)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public Mono<String> complete(String prompt) {
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            return Mono.error(new ProviderUnavailableException(PROVIDER, "API key not configured"));
        }
        if (!rateLimiter.tryConsume(1)) {
            log.warn("Claude API rate limit exceeded. Skipping request.");
            return Mono.error(new ProviderUnavailableException(PROVIDER, "rate limit exceeded"));
        }

        Map<String, Object> requestBody = Map.of(
                "model", config.getModel(),
                "max_tokens", config.getMaxTokens(),
                "temperature", config.getTemperature(),
                "system", SYSTEM_PROMPT,
                "messages", List.of(
                        Map.of("role", "user", "content", prompt)
                )
        );

        log.info("Calling Claude API with model: {}", config.getModel());

        return webClient.post()
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .map(this::extractResponseText)
                .doOnSuccess(response -> log.info("Claude API response received ({} chars)", response.length()))
                .doOnError(error -> log.error("Claude API call failed: {}", error.getMessage()));
    }

    @SuppressWarnings("unchecked")
    private String extractResponseText(Map<String, Object> response) {
        List<Map<String, Object>> content = (List<Map<String, Object>>) response.get("content");
        if (content == null || content.isEmpty()) {
            throw new ProviderUnavailableException(PROVIDER, "empty response");
        }
        String text = (String) content.get(0).get("text");
        if (text == null) {
            throw new ProviderUnavailableException(PROVIDER, "response has no text block");
        }
        return text;
    }
}
