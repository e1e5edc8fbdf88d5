package com.team.issueintel.service.status;

import com.team.issueintel.model.IssueStatus;
import com.team.issueintel.model.dto.StatusSummary;
import com.team.issueintel.model.entity.ReportGenerationTask.TaskStatus;
import com.team.issueintel.repository.BrandRepository;
import com.team.issueintel.repository.IncidentReportRepository;
import com.team.issueintel.repository.IssueRepository;
import com.team.issueintel.repository.ReportGenerationTaskRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StatusService {

    private final IssueRepository issueRepository;
    private final BrandRepository brandRepository;
    private final IncidentReportRepository reportRepository;
    private final ReportGenerationTaskRepository taskRepository;

    public StatusSummary summarize() {
        return StatusSummary.builder()
                .activeIssues(issueRepository.countByStatus(IssueStatus.ACTIVE))
                .monitoringIssues(issueRepository.countByStatus(IssueStatus.MONITORING))
                .resolvedIssues(issueRepository.countByStatus(IssueStatus.RESOLVED))
                .brands(brandRepository.count())
                .incidentReports(reportRepository.count())
                .pendingReportTasks(taskRepository.countByStatus(TaskStatus.PENDING))
                .failedReportTasks(taskRepository.countByStatus(TaskStatus.FAILED))
                .build();
    }
}
