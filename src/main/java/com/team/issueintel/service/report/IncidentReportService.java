package com.team.issueintel.service.report;

import com.team.issueintel.exception.InvalidStateTransitionException;
import com.team.issueintel.exception.NotFoundException;
import com.team.issueintel.model.ReportStatus;
import com.team.issueintel.model.entity.IncidentReport;
import com.team.issueintel.repository.IncidentReportRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Incident report queries and review lifecycle.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IncidentReportService {

    private final IncidentReportRepository reportRepository;

    /**
     * Reports for an issue, newest first; narrowed to one brand when {@code brandId} is given.
     */
    public List<IncidentReport> findReports(String issueId, String brandId) {
        if (brandId != null && !brandId.isBlank()) {
            return reportRepository.findByIssueIdAndBrandId(issueId, brandId)
                    .map(List::of)
                    .orElse(List.of());
        }
        return reportRepository.findByIssueIdOrderByGeneratedAtDesc(issueId);
    }

    public IncidentReport getReport(String reportId) {
        return reportRepository.findById(reportId)
                .orElseThrow(() -> NotFoundException.report(reportId));
    }

    public IncidentReport updateStatus(String reportId, ReportStatus target) {
        IncidentReport report = getReport(reportId);
        if (!report.getStatus().canAdvanceTo(target)) {
            throw new InvalidStateTransitionException("incident report " + reportId,
                    report.getStatus().value(), target != null ? target.value() : null);
        }
        report.setStatus(target);
        if (target == ReportStatus.PUBLISHED) {
            report.setPublishedAt(LocalDateTime.now());
        }
        IncidentReport saved = reportRepository.save(report);
        log.info("Incident report {} moved to {}", reportId, target.value());
        return saved;
    }
}
