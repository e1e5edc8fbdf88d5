package com.team.issueintel.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Generative provider used for incident report content.
 */
@Configuration
@ConfigurationProperties(prefix = "claude")
@Getter
@Setter
public class ClaudeApiConfig {

    private String apiKey;
    private String baseUrl = "https://api.anthropic.com/v1/messages";
    private String model = "claude-sonnet-4-5-20250929";
    private int maxTokens = 2000;
    private double temperature = 0.3;
    private int timeoutSeconds = 60;
}
