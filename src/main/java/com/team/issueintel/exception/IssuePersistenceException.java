package com.team.issueintel.exception;

/**
 * A store read or write failed. Never retried here; the caller owns redelivery.
 */
public class IssuePersistenceException extends IssueIntelligenceException {

    public IssuePersistenceException(String operation, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILED, cause, operation);
    }

    private IssuePersistenceException(ErrorCode errorCode, Throwable cause, Object... args) {
        super(errorCode, cause, args);
    }

    public static IssuePersistenceException concurrentUpdate(String issueId, int attempts, Throwable cause) {
        return new IssuePersistenceException(ErrorCode.CONCURRENT_UPDATE, cause, issueId, attempts);
    }
}
