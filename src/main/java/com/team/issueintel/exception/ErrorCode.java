package com.team.issueintel.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "Invalid request: %s"),
    RESOLUTION_FAILED(HttpStatus.UNPROCESSABLE_ENTITY, "Cannot resolve %s"),
    ISSUE_NOT_FOUND(HttpStatus.NOT_FOUND, "Issue %s not found"),
    REPORT_NOT_FOUND(HttpStatus.NOT_FOUND, "Incident report %s not found"),
    TASK_NOT_FOUND(HttpStatus.NOT_FOUND, "Report generation task %s not found"),
    BRAND_NOT_AFFECTED(HttpStatus.CONFLICT, "Brand %s is not affected by issue %s"),
    INVALID_STATE_TRANSITION(HttpStatus.CONFLICT, "Cannot move %s from %s to %s"),
    CONCURRENT_UPDATE(HttpStatus.SERVICE_UNAVAILABLE, "Issue %s is being updated concurrently, gave up after %d attempts"),
    PERSISTENCE_FAILED(HttpStatus.SERVICE_UNAVAILABLE, "Store operation failed: %s"),
    PROVIDER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "%s unavailable: %s"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error");

    private final HttpStatus status;
    private final String messageFormat;

    public String format(Object... args) {
        return args.length == 0 ? messageFormat : String.format(messageFormat, args);
    }
}
