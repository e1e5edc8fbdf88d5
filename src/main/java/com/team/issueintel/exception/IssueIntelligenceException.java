package com.team.issueintel.exception;

import lombok.Getter;

/**
 * Base of every failure this service reports. Carries an {@link ErrorCode}
 * so the REST layer can map it without instanceof chains.
 */
@Getter
public abstract class IssueIntelligenceException extends RuntimeException {

    private final ErrorCode errorCode;

    protected IssueIntelligenceException(ErrorCode errorCode, Object... args) {
        super(errorCode.format(args));
        this.errorCode = errorCode;
    }

    protected IssueIntelligenceException(ErrorCode errorCode, Throwable cause, Object... args) {
        super(errorCode.format(args), cause);
        this.errorCode = errorCode;
    }
}
