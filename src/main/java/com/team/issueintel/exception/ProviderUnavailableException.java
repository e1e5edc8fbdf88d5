package com.team.issueintel.exception;

/**
 * An embedding or generative provider failed, timed out or was rate limited.
 * Always recovered by a scoring or content fallback before it reaches a caller of the core.
 */
public class ProviderUnavailableException extends IssueIntelligenceException {

    public ProviderUnavailableException(String provider, String reason) {
        super(ErrorCode.PROVIDER_UNAVAILABLE, provider, reason);
    }
}
