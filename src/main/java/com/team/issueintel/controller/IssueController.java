package com.team.issueintel.controller;

import com.team.issueintel.exception.InvalidRequestException;
import com.team.issueintel.model.IssueStatus;
import com.team.issueintel.model.dto.StatusUpdateRequest;
import com.team.issueintel.model.entity.Issue;
import com.team.issueintel.service.issue.IssueService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/issues")
@RequiredArgsConstructor
public class IssueController {

    private final IssueService issueService;

    @GetMapping("/{id}")
    public ResponseEntity<Issue> getIssue(@PathVariable String id) {
        return ResponseEntity.ok(issueService.getIssue(id));
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<Issue> updateStatus(@PathVariable String id, @RequestBody StatusUpdateRequest request) {
        return ResponseEntity.ok(issueService.updateStatus(id, parseStatus(request)));
    }

    private IssueStatus parseStatus(StatusUpdateRequest request) {
        if (request == null || request.getStatus() == null || request.getStatus().isBlank()) {
            throw new InvalidRequestException("status is required");
        }
        try {
            return IssueStatus.from(request.getStatus());
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("unknown issue status '" + request.getStatus() + "'");
        }
    }
}
