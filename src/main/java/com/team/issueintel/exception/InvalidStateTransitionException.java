package com.team.issueintel.exception;

public class InvalidStateTransitionException extends IssueIntelligenceException {

    public InvalidStateTransitionException(String subject, Object from, Object to) {
        super(ErrorCode.INVALID_STATE_TRANSITION, subject, from, to);
    }
}
