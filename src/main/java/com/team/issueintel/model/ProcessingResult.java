package com.team.issueintel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingResult {

    private ProcessingAction action;
    private String issueId;
    private double confidence;
    private List<SimilarIssueSummary> similarIssues;

    /** Brand ids handed to the report outbox for this ticket */
    private List<String> incidentReportsTriggered;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SimilarIssueSummary {
        private String issueId;
        private String title;
        private double similarityScore;
        private MatchType matchType;
        private double confidence;
        private List<String> reasons;

        public static SimilarIssueSummary from(SimilarIssue match) {
            return SimilarIssueSummary.builder()
                    .issueId(match.issue().getId())
                    .title(match.issue().getTitle())
                    .similarityScore(match.score())
                    .matchType(match.similarity().getMatchType())
                    .confidence(match.similarity().getConfidence())
                    .reasons(match.similarity().getReasons())
                    .build();
        }
    }
}
