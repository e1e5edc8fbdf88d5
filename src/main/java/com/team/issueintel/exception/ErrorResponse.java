package com.team.issueintel.exception;

import org.springframework.http.ResponseEntity;

import java.time.LocalDateTime;

public record ErrorResponse(String code, String message, LocalDateTime timestamp) {

    public static ResponseEntity<ErrorResponse> toResponseEntity(IssueIntelligenceException e) {
        return ResponseEntity.status(e.getErrorCode().getStatus())
                .body(new ErrorResponse(e.getErrorCode().name(), e.getMessage(), LocalDateTime.now()));
    }

    public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
        return ResponseEntity.status(errorCode.getStatus())
                .body(new ErrorResponse(errorCode.name(), errorCode.format(), LocalDateTime.now()));
    }
}
