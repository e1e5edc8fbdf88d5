package com.team.issueintel.exception;

public class NotFoundException extends IssueIntelligenceException {

    private NotFoundException(ErrorCode errorCode, Object id) {
        super(errorCode, id);
    }

    public static NotFoundException issue(String issueId) {
        return new NotFoundException(ErrorCode.ISSUE_NOT_FOUND, issueId);
    }

    public static NotFoundException report(String reportId) {
        return new NotFoundException(ErrorCode.REPORT_NOT_FOUND, reportId);
    }

    public static NotFoundException task(Long taskId) {
        return new NotFoundException(ErrorCode.TASK_NOT_FOUND, taskId);
    }
}
