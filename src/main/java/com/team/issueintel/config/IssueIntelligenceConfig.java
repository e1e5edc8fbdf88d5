package com.team.issueintel.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Tunables of the deduplication and impact engine.
 * The 0.8 link threshold and the scoring weights are fixed constants in code, not settings.
 */
@Configuration
@ConfigurationProperties(prefix = "issue-intelligence")
@Getter
@Setter
public class IssueIntelligenceConfig {

    /** How many most-recently-updated issues are compared against each ticket */
    private int candidatePoolSize = 100;

    /** Minimum combined score for a candidate to be returned by the matcher */
    private double matchThreshold = 0.3;

    /** Affected-member total at which incident reports are generated automatically */
    private int autoReportThreshold = 10;

    /** Optimistic-lock retries for one issue update before giving up */
    private int maxUpdateAttempts = 5;

    private ReportOutbox reportOutbox = new ReportOutbox();

    @Getter
    @Setter
    public static class ReportOutbox {
        private boolean enabled = true;
        private int batchSize = 10;
        private int maxAttempts = 3;
        private long pollIntervalMs = 5000;
    }
}
