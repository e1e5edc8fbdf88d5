package com.team.issueintel.exception;

public class InvalidRequestException extends IssueIntelligenceException {

    public InvalidRequestException(String reason) {
        super(ErrorCode.INVALID_REQUEST, reason);
    }
}
