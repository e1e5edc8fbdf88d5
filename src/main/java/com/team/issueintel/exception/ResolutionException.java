package com.team.issueintel.exception;

/**
 * The ticket references a brand or location that cannot be resolved. Fatal for that ticket.
 */
public class ResolutionException extends IssueIntelligenceException {

    public ResolutionException(String what) {
        super(ErrorCode.RESOLUTION_FAILED, what);
    }
}
