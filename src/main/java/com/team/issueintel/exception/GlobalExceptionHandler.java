package com.team.issueintel.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IssueIntelligenceException.class)
    protected ResponseEntity<ErrorResponse> handleIssueIntelligenceException(IssueIntelligenceException e) {
        if (e.getErrorCode().getStatus().is5xxServerError()) {
            log.error("Request failed: {} | {}", e.getErrorCode(), e.getMessage(), e);
        } else {
            log.warn("Request rejected: {} | {}", e.getErrorCode(), e.getMessage());
        }
        return ErrorResponse.toResponseEntity(e);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    protected ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return ErrorResponse.toResponseEntity(new InvalidRequestException("malformed request"));
    }

    @ExceptionHandler(Exception.class)
    protected ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unexpected failure", e);
        return ErrorResponse.toResponseEntity(ErrorCode.INTERNAL_ERROR);
    }
}
