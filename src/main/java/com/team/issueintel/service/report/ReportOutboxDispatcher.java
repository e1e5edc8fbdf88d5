package com.team.issueintel.service.report;

import com.team.issueintel.config.IssueIntelligenceConfig;
import com.team.issueintel.exception.BrandNotAffectedException;
import com.team.issueintel.exception.NotFoundException;
import com.team.issueintel.model.entity.IncidentReport;
import com.team.issueintel.model.entity.ReportGenerationTask;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Drains pending report tasks on a fixed delay.
 * Each task gets {@code report-outbox.max-attempts} tries; a missing issue or brand impact fails it at once.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReportOutboxDispatcher {

    private final ReportOutbox outbox;
    private final IncidentReportSynthesizer synthesizer;
    private final IssueIntelligenceConfig config;

    @Scheduled(fixedDelayString = "${issue-intelligence.report-outbox.poll-interval-ms:5000}")
    public void dispatchPending() {
        IssueIntelligenceConfig.ReportOutbox settings = config.getReportOutbox();
        if (!settings.isEnabled()) {
            log.debug("Report outbox disabled, skipping dispatch");
            return;
        }

        List<ReportGenerationTask> tasks;
        try {
            tasks = outbox.pending(settings.getBatchSize());
        } catch (Exception e) {
            log.error("Could not read pending report tasks: {}", e.getMessage());
            return;
        }
        if (tasks.isEmpty()) {
            return;
        }

        log.info("Dispatching {} report generation tasks", tasks.size());
        for (ReportGenerationTask task : tasks) {
            dispatch(task, settings.getMaxAttempts());
        }
    }

    void dispatch(ReportGenerationTask task, int maxAttempts) {
        try {
            IncidentReport report = synthesizer.generate(task.getIssueId(), task.getBrandId());
            outbox.markCompleted(task, report.getId());
            log.info("Report task {} completed: report {}", task.getId(), report.getId());
        } catch (BrandNotAffectedException | NotFoundException e) {
            log.error("Report task {} cannot be completed: {}", task.getId(), e.getMessage());
            markFailed(task, e.getMessage(), maxAttempts, true);
        } catch (Exception e) {
            log.warn("Report task {} attempt {} failed: {}", task.getId(), task.getAttempts() + 1, e.getMessage());
            markFailed(task, e.getMessage(), maxAttempts, false);
        }
    }

    private void markFailed(ReportGenerationTask task, String error, int maxAttempts, boolean permanent) {
        try {
            outbox.markAttemptFailed(task, error, maxAttempts, permanent);
        } catch (Exception e) {
            log.error("Could not record failure of report task {}: {}", task.getId(), e.getMessage());
        }
    }
}
