package com.team.issueintel.controller;

import com.team.issueintel.exception.InvalidRequestException;
import com.team.issueintel.model.ReportStatus;
import com.team.issueintel.model.dto.IncidentReportRequest;
import com.team.issueintel.model.dto.StatusUpdateRequest;
import com.team.issueintel.model.entity.IncidentReport;
import com.team.issueintel.service.report.IncidentReportService;
import com.team.issueintel.service.report.IncidentReportSynthesizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Incident report endpoints:
 * - POST  /api/incident-reports               generate (or return the existing) report for an issue and brand
 * - GET   /api/incident-reports?issueId=      reports of an issue, optionally for one brand
 * - PATCH /api/incident-reports/{id}/status   advance the review status
 */
@RestController
@RequestMapping("/api/incident-reports")
@Slf4j
@RequiredArgsConstructor
public class IncidentReportController {

    private final IncidentReportSynthesizer synthesizer;
    private final IncidentReportService reportService;

    @PostMapping
    public ResponseEntity<IncidentReport> generate(@RequestBody IncidentReportRequest request) {
        if (request == null || isBlank(request.getIssueId()) || isBlank(request.getBrandId())) {
            throw new InvalidRequestException("issueId and brandId are required");
        }
        log.info("Incident report requested for issue {}, brand {}", request.getIssueId(), request.getBrandId());
        return ResponseEntity.ok(synthesizer.generate(request.getIssueId(), request.getBrandId()));
    }

    @GetMapping
    public ResponseEntity<List<IncidentReport>> findReports(
            @RequestParam String issueId,
            @RequestParam(required = false) String brandId) {
        return ResponseEntity.ok(reportService.findReports(issueId, brandId));
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<IncidentReport> updateStatus(@PathVariable String id,
                                                       @RequestBody StatusUpdateRequest request) {
        if (request == null || isBlank(request.getStatus())) {
            throw new InvalidRequestException("status is required");
        }
        ReportStatus target;
        try {
            target = ReportStatus.from(request.getStatus());
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("unknown report status '" + request.getStatus() + "'");
        }
        return ResponseEntity.ok(reportService.updateStatus(id, target));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
