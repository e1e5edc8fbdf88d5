package com.team.issueintel.controller;

import com.team.issueintel.model.dto.StatusSummary;
import com.team.issueintel.service.status.StatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/status")
@RequiredArgsConstructor
public class StatusController {

    private final StatusService statusService;

    @GetMapping
    public ResponseEntity<StatusSummary> status() {
        return ResponseEntity.ok(statusService.summarize());
    }
}
