package com.team.issueintel.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusSummary {

    private long activeIssues;
    private long monitoringIssues;
    private long resolvedIssues;
    private long brands;
    private long incidentReports;
    private long pendingReportTasks;
    private long failedReportTasks;
}
