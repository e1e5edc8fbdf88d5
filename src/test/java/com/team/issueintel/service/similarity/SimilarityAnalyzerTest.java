package com.team.issueintel.service.similarity;

import com.team.issueintel.TestFixtures;
import com.team.issueintel.model.MatchType;
import com.team.issueintel.model.NormalizedTicket;
import com.team.issueintel.model.SimilarityResult;
import com.team.issueintel.model.entity.Issue;
import com.team.issueintel.service.embedding.EmbeddingGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static com.team.issueintel.TestFixtures.BRAND;
import static com.team.issueintel.TestFixtures.LOCATION;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("SimilarityAnalyzer")
class SimilarityAnalyzerTest {

    @Mock
    private EmbeddingGateway embeddingGateway;

    private SimilarityAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new SimilarityAnalyzer(embeddingGateway);
    }

    @Test
    @DisplayName("identical vectors, identical text and same location score 1.0")
    void analyze_identical() {
        NormalizedTicket ticket = TestFixtures.ticket("t-1", "Mobile app login failure", "Members cannot login");
        Issue issue = TestFixtures.issue("i-1", "Mobile app login failure", "Members cannot login",
                TestFixtures.brandImpact(BRAND, TestFixtures.location(LOCATION, BRAND, 1, 450)));
        issue.setEmbedding(new double[]{1, 2, 3});

        SimilarityResult result = analyzer.analyze(ticket, new double[]{1, 2, 3}, issue);

        assertThat(result.getSemanticScore()).isCloseTo(1.0, within(1e-9));
        assertThat(result.getKeywordScore()).isEqualTo(1.0);
        assertThat(result.getOrganizationalScore()).isEqualTo(1.0);
        assertThat(result.getCombinedScore()).isCloseTo(1.0, within(1e-9));
        assertThat(result.getMatchType()).isEqualTo(MatchType.CUSTOMER);
        assertThat(result.getConfidence()).isEqualTo(1.0);
        assertThat(result.getReasons()).containsExactly(
                "High semantic similarity: 100.0%", "Keyword overlap: 100.0%", "Same brand/location affected");
        verify(embeddingGateway, never()).tryEmbed(anyString());
    }

    @Test
    @DisplayName("all scores stay in [0, 1] for empty texts and missing embeddings")
    void analyze_emptyTexts_bounded() {
        NormalizedTicket ticket = TestFixtures.ticket("t-1", "", "");
        Issue issue = TestFixtures.issue("i-1", "", "");
        given(embeddingGateway.tryEmbed(anyString())).willReturn(Optional.empty());

        SimilarityResult result = analyzer.analyze(ticket, issue);

        assertThat(result.getSemanticScore()).isBetween(0.0, 1.0);
        assertThat(result.getKeywordScore()).isBetween(0.0, 1.0);
        assertThat(result.getOrganizationalScore()).isBetween(0.0, 1.0);
        assertThat(result.getCombinedScore()).isBetween(0.0, 1.0);
        assertThat(result.getCombinedScore()).isZero();
    }

    @Test
    @DisplayName("issue without cached embedding is embedded on demand")
    void semanticScore_embedsIssueOnDemand() {
        Issue issue = TestFixtures.issue("i-1", "Payment failed", "Card declined");
        given(embeddingGateway.tryEmbed(issue.text())).willReturn(Optional.of(new double[]{0, 1}));

        double score = analyzer.semanticScore(new double[]{0, 1}, issue);

        assertThat(score).isCloseTo(1.0, within(1e-9));
        assertThat(issue.hasEmbedding()).isFalse();
    }

    @Test
    @DisplayName("issue embedding failure drops the semantic score to 0")
    void semanticScore_issueEmbeddingUnavailable() {
        Issue issue = TestFixtures.issue("i-1", "Payment failed", "Card declined");
        given(embeddingGateway.tryEmbed(issue.text())).willReturn(Optional.empty());

        assertThat(analyzer.semanticScore(new double[]{0, 1}, issue)).isZero();
    }

    @Test
    @DisplayName("organizational score: 1.0 same location, 0.7 same brand only, 0 otherwise")
    void organizationalScore_levels() {
        Issue issue = TestFixtures.issue("i-1", "x", "y",
                TestFixtures.brandImpact(BRAND, TestFixtures.location(LOCATION, BRAND, 1, 450)));

        assertThat(analyzer.organizationalScore(TestFixtures.ticket("t-1", "a", "b"), issue)).isEqualTo(1.0);
        assertThat(analyzer.organizationalScore(
                TestFixtures.ticket("t-2", "a", "b", null, BRAND, "gym-002"), issue)).isEqualTo(0.7);
        assertThat(analyzer.organizationalScore(
                TestFixtures.ticket("t-3", "a", "b", null, "other", "gym-009"), issue)).isZero();
    }

    @Test
    @DisplayName("keyword score is the Jaccard index of keyword sets")
    void keywordScore_jaccard() {
        NormalizedTicket ticket = TestFixtures.ticket("t-1", "mobile login failure", "");
        Issue issue = TestFixtures.issue("i-1", "mobile login timeout", "");

        // {mobile, login} / {mobile, login, failure, timeout}
        assertThat(analyzer.keywordScore(ticket, issue)).isEqualTo(0.5);
    }

    @Test
    @DisplayName("cosine similarity is clamped and handles degenerate vectors")
    void cosineSimilarity_edgeCases() {
        assertThat(SimilarityAnalyzer.cosineSimilarity(new double[]{1, 0}, new double[]{-1, 0})).isZero();
        assertThat(SimilarityAnalyzer.cosineSimilarity(new double[]{0, 0}, new double[]{1, 1})).isZero();
        assertThat(SimilarityAnalyzer.cosineSimilarity(new double[]{1, 2}, new double[]{1, 2, 3})).isZero();
        assertThat(SimilarityAnalyzer.cosineSimilarity(new double[0], new double[0])).isZero();
        assertThat(SimilarityAnalyzer.cosineSimilarity(null, new double[]{1})).isZero();
    }

    @Test
    @DisplayName("classification follows the semantic, keyword, organizational precedence")
    void classify_precedence() {
        assertThat(SimilarityAnalyzer.classify(0.85, 0.65, 0).matchType()).isEqualTo(MatchType.CUSTOMER);
        assertThat(SimilarityAnalyzer.classify(0.75, 0.1, 1.0).matchType()).isEqualTo(MatchType.SEMANTIC);
        assertThat(SimilarityAnalyzer.classify(0.2, 0.7, 1.0).matchType()).isEqualTo(MatchType.KEYWORD);
        assertThat(SimilarityAnalyzer.classify(0.2, 0.2, 1.0).matchType()).isEqualTo(MatchType.BRAND_LOCATION);

        SimilarityAnalyzer.Classification weak = SimilarityAnalyzer.classify(0.2, 0.4, 0.7);
        assertThat(weak.matchType()).isEqualTo(MatchType.SEMANTIC);
        assertThat(weak.confidence()).isEqualTo(0.7);
    }
}
