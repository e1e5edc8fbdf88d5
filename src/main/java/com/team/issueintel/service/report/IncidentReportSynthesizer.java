package com.team.issueintel.service.report;

import com.team.issueintel.config.ClaudeApiConfig;
import com.team.issueintel.config.IssueIntelligenceConfig;
import com.team.issueintel.exception.BrandNotAffectedException;
import com.team.issueintel.exception.IssuePersistenceException;
import com.team.issueintel.exception.NotFoundException;
import com.team.issueintel.model.BrandImpact;
import com.team.issueintel.model.GeneratedReport;
import com.team.issueintel.model.entity.BrandReference;
import com.team.issueintel.model.entity.IncidentReport;
import com.team.issueintel.model.entity.Issue;
import com.team.issueintel.model.entity.TicketRecord;
import com.team.issueintel.repository.BrandRepository;
import com.team.issueintel.repository.IncidentReportRepository;
import com.team.issueintel.repository.IssueRepository;
import com.team.issueintel.repository.TicketRecordRepository;
import com.team.issueintel.service.claude.GenerativeContentProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Generates brand-specific incident reports for an issue.
 *
 * Flow:
 * 1. Resolve the issue and the brand's impact record
 * 2. Gather brand reference and linked ticket summaries (best effort)
 * 3. Ask the generative provider for the report sections
 * 4. Fall back to the deterministic template when generation fails or leaves sections blank
 * 5. Persist as draft and record the report id on the issue
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IncidentReportSynthesizer {

    static final String UNKNOWN_DOWNTIME = "Unknown";
    static final String DEFAULT_ROOT_CAUSE = "Under investigation";
    static final String DEFAULT_CUSTOMER_SEGMENTS = "All Members";

    private final IssueRepository issueRepository;
    private final IncidentReportRepository reportRepository;
    private final BrandRepository brandRepository;
    private final TicketRecordRepository ticketRecordRepository;
    private final GenerativeContentProvider contentProvider;
    private final PromptBuilder promptBuilder;
    private final ResponseParser responseParser;
    private final FallbackReportTemplate fallbackTemplate;
    private final ClaudeApiConfig claudeConfig;
    private final IssueIntelligenceConfig config;

    public IncidentReport generate(String issueId, String brandId) {
        log.info("Generating incident report for issue {}, brand {}", issueId, brandId);
        try {
            return doGenerate(issueId, brandId);
        } catch (DataAccessException e) {
            throw new IssuePersistenceException("generate incident report for issue " + issueId, e);
        }
    }

    private IncidentReport doGenerate(String issueId, String brandId) {
        Issue issue = issueRepository.findById(issueId)
                .orElseThrow(() -> NotFoundException.issue(issueId));
        BrandImpact brandImpact = issue.findBrandImpact(brandId)
                .orElseThrow(() -> new BrandNotAffectedException(brandId, issueId));

        Optional<IncidentReport> existing = reportRepository.findByIssueIdAndBrandId(issueId, brandId);
        if (existing.isPresent()) {
            log.info("Incident report {} already exists for issue {}, brand {}",
                    existing.get().getId(), issueId, brandId);
            return ensureRecorded(issue, existing.get());
        }

        BrandReference brand = findBrand(brandId);
        String brandName = brand != null ? brand.getName() : brandImpact.getBrandName();
        List<TicketRecord> tickets = findTickets(issue);

        GeneratedReport fallback = fallbackTemplate.build(issue, brandName, brandImpact);
        GeneratedReport content = generateContent(issue, brand, brandImpact, tickets, fallback);

        IncidentReport report = toReport(issueId, brandId, brandImpact, content);
        IncidentReport saved;
        try {
            saved = reportRepository.save(report);
        } catch (DataIntegrityViolationException e) {
            // Another worker stored the report for this pair first
            log.info("Incident report for issue {}, brand {} was created concurrently", issueId, brandId);
            IncidentReport winner = reportRepository.findByIssueIdAndBrandId(issueId, brandId).orElseThrow(() -> e);
            return ensureRecorded(issue, winner);
        }

        recordOnIssue(issueId, brandId, saved.getId());
        log.info("Generated incident report {} for issue {}, brand {} ({})",
                saved.getId(), issueId, brandId, saved.getGeneratedBy());
        return saved;
    }

    private GeneratedReport generateContent(Issue issue, BrandReference brand, BrandImpact brandImpact,
                                            List<TicketRecord> tickets, GeneratedReport fallback) {
        try {
            String prompt = promptBuilder.buildIncidentReportPrompt(issue, brand, brandImpact, tickets);
            String response = contentProvider.complete(prompt)
                    .block(Duration.ofSeconds(claudeConfig.getTimeoutSeconds()));
            GeneratedReport generated = responseParser.parseIncidentReport(response);
            return fallbackTemplate.fillBlanks(generated, fallback);
        } catch (Exception e) {
            log.warn("Report generation failed for issue {}, brand {}, using fallback template: {}",
                    issue.getId(), brandImpact.getBrandId(), e.getMessage());
            return fallback;
        }
    }

    private BrandReference findBrand(String brandId) {
        try {
            return brandRepository.findById(brandId).orElse(null);
        } catch (DataAccessException e) {
            log.warn("Brand lookup failed for {}: {}", brandId, e.getMessage());
            return null;
        }
    }

    private List<TicketRecord> findTickets(Issue issue) {
        List<TicketRecord> tickets = new ArrayList<>();
        for (String ticketId : issue.getLinkedTicketIds()) {
            try {
                ticketRecordRepository.findById(ticketId).ifPresentOrElse(tickets::add,
                        () -> log.debug("Ticket {} has no stored summary", ticketId));
            } catch (DataAccessException e) {
                log.warn("Ticket lookup failed for {}: {}", ticketId, e.getMessage());
            }
        }
        return tickets;
    }

    private IncidentReport toReport(String issueId, String brandId, BrandImpact brandImpact, GeneratedReport content) {
        return IncidentReport.builder()
                .id("incident_" + UUID.randomUUID().toString().replace("-", "") + "_" + brandId)
                .issueId(issueId)
                .brandId(brandId)
                .generatedAt(LocalDateTime.now())
                .generatedBy(content.isFallback() ? IncidentReport.GENERATED_BY_TEMPLATE : IncidentReport.GENERATED_BY_AI)
                .content(IncidentReport.Content.builder()
                        .title(content.getTitle())
                        .summary(content.getSummary())
                        .impactAssessment(content.getImpactAnalysis())
                        .timeline(content.getTimeline())
                        .rootCause(DEFAULT_ROOT_CAUSE)
                        .resolution(content.getCurrentStatus())
                        .preventiveMeasures(String.join("\n", content.getNextSteps()))
                        .communicationPlan(content.getBrandSpecificNotes())
                        .build())
                .metadata(IncidentReport.Metadata.builder()
                        .totalAffectedMembers(brandImpact.getTotalAffectedMembers())
                        .affectedLocations(brandImpact.getLocationImpacts().size())
                        .estimatedDowntime(content.getEstimatedResolution() != null
                                && !content.getEstimatedResolution().isBlank()
                                ? content.getEstimatedResolution() : UNKNOWN_DOWNTIME)
                        .businessImpact(brandImpact.getImpactLevel())
                        .customerSegments(DEFAULT_CUSTOMER_SEGMENTS)
                        .build())
                .build();
    }

    /**
     * A stored report whose id never reached the issue (an earlier attempt failed in between)
     * is recorded now.
     */
    private IncidentReport ensureRecorded(Issue issue, IncidentReport report) {
        if (!report.getId().equals(issue.getIncidentReports().get(report.getBrandId()))) {
            log.info("Recording existing incident report {} on issue {}", report.getId(), issue.getId());
            recordOnIssue(issue.getId(), report.getBrandId(), report.getId());
        }
        return report;
    }

    private void recordOnIssue(String issueId, String brandId, String reportId) {
        int maxAttempts = Math.max(1, config.getMaxUpdateAttempts());
        for (int attempt = 1; ; attempt++) {
            Issue issue = issueRepository.findById(issueId)
                    .orElseThrow(() -> NotFoundException.issue(issueId));
            issue.recordIncidentReport(brandId, reportId);
            try {
                issueRepository.save(issue);
                return;
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= maxAttempts) {
                    throw IssuePersistenceException.concurrentUpdate(issueId, attempt, e);
                }
                log.warn("Concurrent update on issue {} while recording report (attempt {}/{}), retrying",
                        issueId, attempt, maxAttempts);
            }
        }
    }
}
