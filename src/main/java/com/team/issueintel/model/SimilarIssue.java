package com.team.issueintel.model;

import com.team.issueintel.model.entity.Issue;

/**
 * A candidate issue together with how well it matched the incoming ticket.
 */
public record SimilarIssue(Issue issue, SimilarityResult similarity) {

    public double score() {
        return similarity.getCombinedScore();
    }
}
