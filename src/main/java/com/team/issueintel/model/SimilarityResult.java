package com.team.issueintel.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of comparing one ticket against one issue. Scores are heuristic and lie in [0, 1].
 */
@Value
@Builder
public class SimilarityResult {

    double semanticScore;
    double keywordScore;
    double organizationalScore;
    double combinedScore;
    MatchType matchType;
    double confidence;
    List<String> reasons;
}
