package com.team.issueintel.service.similarity;

import com.team.issueintel.model.BrandImpact;
import com.team.issueintel.model.MatchType;
import com.team.issueintel.model.NormalizedTicket;
import com.team.issueintel.model.SimilarityResult;
import com.team.issueintel.model.entity.Issue;
import com.team.issueintel.service.embedding.EmbeddingGateway;
import com.team.issueintel.util.TextPreprocessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Scores how likely a ticket describes the same problem as an existing issue.
 *
 * Three signals are blended into one combined score:
 * - semantic: cosine similarity of title + description embeddings
 * - keyword: Jaccard similarity of extracted keyword sets
 * - organizational: whether the ticket's brand/location is already affected by the issue
 *
 * Scores are heuristic. Provider failures never propagate; the semantic signal drops to 0.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SimilarityAnalyzer {

    static final double SEMANTIC_WEIGHT = 0.5;
    static final double KEYWORD_WEIGHT = 0.3;
    static final double ORGANIZATIONAL_WEIGHT = 0.2;

    static final double BRAND_AND_LOCATION_MATCH = 1.0;
    static final double BRAND_ONLY_MATCH = 0.7;

    // Thresholds for adding a human-readable reason
    private static final double SEMANTIC_REASON_THRESHOLD = 0.7;
    private static final double KEYWORD_REASON_THRESHOLD = 0.5;
    private static final double ORGANIZATIONAL_REASON_THRESHOLD = 0.8;

    private final EmbeddingGateway embeddingGateway;

    public SimilarityResult analyze(NormalizedTicket ticket, Issue issue) {
        double[] ticketEmbedding = embeddingGateway.tryEmbed(ticket.text()).orElse(null);
        return analyze(ticket, ticketEmbedding, issue);
    }

    /**
     * @param ticketEmbedding embedding of the ticket text, or null when unavailable
     */
    public SimilarityResult analyze(NormalizedTicket ticket, double[] ticketEmbedding, Issue issue) {
        List<String> reasons = new ArrayList<>();

        double semantic = semanticScore(ticketEmbedding, issue);
        if (semantic > SEMANTIC_REASON_THRESHOLD) {
            reasons.add("High semantic similarity: " + percent(semantic));
        }

        double keyword = keywordScore(ticket, issue);
        if (keyword > KEYWORD_REASON_THRESHOLD) {
            reasons.add("Keyword overlap: " + percent(keyword));
        }

        double organizational = organizationalScore(ticket, issue);
        if (organizational > ORGANIZATIONAL_REASON_THRESHOLD) {
            reasons.add("Same brand/location affected");
        }

        double combined = clamp(semantic * SEMANTIC_WEIGHT
                + keyword * KEYWORD_WEIGHT
                + organizational * ORGANIZATIONAL_WEIGHT);

        Classification classification = classify(semantic, keyword, organizational);

        return SimilarityResult.builder()
                .semanticScore(semantic)
                .keywordScore(keyword)
                .organizationalScore(organizational)
                .combinedScore(combined)
                .matchType(classification.matchType())
                .confidence(classification.confidence())
                .reasons(reasons)
                .build();
    }

    /**
     * Uses the issue's cached embedding when present, otherwise embeds the issue text on demand.
     * The on-demand vector is not written back.
     */
    double semanticScore(double[] ticketEmbedding, Issue issue) {
        if (ticketEmbedding == null || ticketEmbedding.length == 0) {
            return 0.0;
        }
        Optional<double[]> issueEmbedding = issue.hasEmbedding()
                ? Optional.of(issue.getEmbedding())
                : embeddingGateway.tryEmbed(issue.text());
        return issueEmbedding
                .map(vector -> cosineSimilarity(ticketEmbedding, vector))
                .orElse(0.0);
    }

    public double keywordScore(NormalizedTicket ticket, Issue issue) {
        Set<String> ticketKeywords = TextPreprocessor.keywords(ticket.text());
        Set<String> issueKeywords = TextPreprocessor.keywords(issue.text());
        if (ticketKeywords.isEmpty() || issueKeywords.isEmpty()) {
            return 0.0;
        }

        Set<String> intersection = new HashSet<>(ticketKeywords);
        intersection.retainAll(issueKeywords);
        Set<String> union = new HashSet<>(ticketKeywords);
        union.addAll(issueKeywords);

        return (double) intersection.size() / union.size();
    }

    public double organizationalScore(NormalizedTicket ticket, Issue issue) {
        NormalizedTicket.Customer customer = ticket.getCustomer();
        if (customer == null || customer.getBrandId() == null) {
            return 0.0;
        }
        Optional<BrandImpact> brandImpact = issue.findBrandImpact(customer.getBrandId());
        if (brandImpact.isEmpty()) {
            return 0.0;
        }
        boolean locationMatch = customer.getLocationId() != null
                && brandImpact.get().findLocation(customer.getLocationId()).isPresent();
        return locationMatch ? BRAND_AND_LOCATION_MATCH : BRAND_ONLY_MATCH;
    }

    /**
     * Cosine similarity clamped to [0, 1]. Empty or mismatched vectors score 0.
     */
    public static double cosineSimilarity(double[] a, double[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        double magnitude = Math.sqrt(normA) * Math.sqrt(normB);
        if (magnitude == 0) {
            return 0.0;
        }
        return clamp(dot / magnitude);
    }

    static Classification classify(double semantic, double keyword, double organizational) {
        if (semantic > 0.8 && keyword > 0.6) {
            return new Classification(MatchType.CUSTOMER, Math.min(semantic + keyword, 1.0));
        }
        if (semantic > 0.7) {
            return new Classification(MatchType.SEMANTIC, semantic);
        }
        if (keyword > 0.6) {
            return new Classification(MatchType.KEYWORD, keyword);
        }
        if (organizational > 0.8) {
            return new Classification(MatchType.BRAND_LOCATION, organizational);
        }
        return new Classification(MatchType.SEMANTIC, Math.max(semantic, Math.max(keyword, organizational)));
    }

    static String percent(double score) {
        return String.format(Locale.ROOT, "%.1f%%", score * 100);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }

    record Classification(MatchType matchType, double confidence) {
    }
}
