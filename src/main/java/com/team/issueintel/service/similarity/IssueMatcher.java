package com.team.issueintel.service.similarity;

import com.team.issueintel.model.MatchType;
import com.team.issueintel.model.NormalizedTicket;
import com.team.issueintel.model.SimilarIssue;
import com.team.issueintel.model.SimilarityResult;
import com.team.issueintel.model.entity.Issue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks a bounded pool of candidate issues against one ticket.
 *
 * Resolved issues are skipped and candidates under the threshold are dropped.
 * The ticket's embedding is computed once by the caller; when it is missing, matching
 * continues on keyword and organizational overlap only.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IssueMatcher {

    public static final double DEFAULT_THRESHOLD = 0.3;

    static final double FALLBACK_KEYWORD_WEIGHT = 0.7;
    static final double FALLBACK_ORGANIZATIONAL_WEIGHT = 0.3;

    private final SimilarityAnalyzer similarityAnalyzer;

    /**
     * @param ticketEmbedding embedding of the ticket text, or null when the provider was unavailable
     * @return matches at or above {@code threshold}, highest combined score first
     */
    public List<SimilarIssue> findMatches(NormalizedTicket ticket, double[] ticketEmbedding,
                                          List<Issue> candidates, double threshold) {
        if (ticketEmbedding == null || ticketEmbedding.length == 0) {
            log.warn("No embedding for ticket {}, falling back to keyword matching", ticket.getTicketId());
            return fallbackMatches(ticket, candidates, threshold);
        }

        List<SimilarIssue> matches = new ArrayList<>();
        for (Issue issue : candidates) {
            if (issue.isResolved()) continue;

            try {
                SimilarityResult result = similarityAnalyzer.analyze(ticket, ticketEmbedding, issue);
                if (result.getCombinedScore() >= threshold) {
                    matches.add(new SimilarIssue(issue, result));
                }
            } catch (RuntimeException e) {
                log.warn("Failed to analyze similarity for issue {}: {}", issue.getId(), e.getMessage());
            }
        }

        matches.sort(Comparator.comparingDouble(SimilarIssue::score).reversed());
        log.debug("Ticket {}: {} of {} candidates matched", ticket.getTicketId(), matches.size(), candidates.size());
        return matches;
    }

    private List<SimilarIssue> fallbackMatches(NormalizedTicket ticket, List<Issue> candidates, double threshold) {
        List<SimilarIssue> matches = new ArrayList<>();
        for (Issue issue : candidates) {
            if (issue.isResolved()) continue;

            double keyword = similarityAnalyzer.keywordScore(ticket, issue);
            double organizational = similarityAnalyzer.organizationalScore(ticket, issue);
            double combined = keyword * FALLBACK_KEYWORD_WEIGHT + organizational * FALLBACK_ORGANIZATIONAL_WEIGHT;

            if (combined >= threshold) {
                List<String> reasons = new ArrayList<>();
                reasons.add("Keyword similarity: " + SimilarityAnalyzer.percent(keyword));
                if (organizational > 0.8) {
                    reasons.add("Same brand/location affected");
                }
                SimilarityResult result = SimilarityResult.builder()
                        .semanticScore(0.0)
                        .keywordScore(keyword)
                        .organizationalScore(organizational)
                        .combinedScore(combined)
                        .matchType(MatchType.KEYWORD)
                        .confidence(combined)
                        .reasons(reasons)
                        .build();
                matches.add(new SimilarIssue(issue, result));
            }
        }

        matches.sort(Comparator.comparingDouble(SimilarIssue::score).reversed());
        return matches;
    }
}
