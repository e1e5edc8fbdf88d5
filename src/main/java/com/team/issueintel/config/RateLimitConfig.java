package com.team.issueintel.config;

import io.github.bucket4j.Bucket;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class RateLimitConfig {

    @Value("${rate-limit.claude-api.requests-per-minute:10}")
    private int claudeRequestsPerMinute;

    @Value("${rate-limit.claude-api.requests-per-hour:100}")
    private int claudeRequestsPerHour;

    @Value("${rate-limit.embedding-api.requests-per-minute:120}")
    private int embeddingRequestsPerMinute;

    @Bean(name = "claudeApiRateLimiter")
    public Bucket claudeApiRateLimiter() {
        return Bucket.builder()
                .addLimit(limit -> limit.capacity(claudeRequestsPerMinute).refillGreedy(claudeRequestsPerMinute, Duration.ofMinutes(1)))
                .addLimit(limit -> limit.capacity(claudeRequestsPerHour).refillGreedy(claudeRequestsPerHour, Duration.ofHours(1)))
                .build();
    }

    @Bean(name = "embeddingApiRateLimiter")
    public Bucket embeddingApiRateLimiter() {
        return Bucket.builder()
                .addLimit(limit -> limit.capacity(embeddingRequestsPerMinute).refillGreedy(embeddingRequestsPerMinute, Duration.ofMinutes(1)))
                .build();
    }
}
