package com.team.issueintel.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Text embedding endpoint (OpenAI-compatible /embeddings API).
 */
@Configuration
@ConfigurationProperties(prefix = "embedding")
@Getter
@Setter
public class EmbeddingApiConfig {

    private String baseUrl = "https://api.openai.com/v1";
    private String apiKey;
    private String model = "text-embedding-3-small";
    private int timeoutSeconds = 10;

    @Bean(name = "embeddingWebClient")
    public WebClient embeddingWebClient() {
        return WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + (apiKey != null ? apiKey : ""))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
