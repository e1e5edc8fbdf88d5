package com.team.issueintel.service.issue;

import com.team.issueintel.config.IssueIntelligenceConfig;
import com.team.issueintel.exception.InvalidRequestException;
import com.team.issueintel.exception.IssueIntelligenceException;
import com.team.issueintel.exception.IssuePersistenceException;
import com.team.issueintel.exception.NotFoundException;
import com.team.issueintel.model.BrandImpact;
import com.team.issueintel.model.ImpactLevel;
import com.team.issueintel.model.IssueStatus;
import com.team.issueintel.model.NormalizedTicket;
import com.team.issueintel.model.Priority;
import com.team.issueintel.model.ProcessingAction;
import com.team.issueintel.model.ProcessingResult;
import com.team.issueintel.model.ProcessingResult.SimilarIssueSummary;
import com.team.issueintel.model.SimilarIssue;
import com.team.issueintel.model.entity.Issue;
import com.team.issueintel.repository.IssueRepository;
import com.team.issueintel.service.embedding.EmbeddingGateway;
import com.team.issueintel.service.report.ReportOutbox;
import com.team.issueintel.service.similarity.IssueMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Entry point for incoming tickets.
 *
 * Flow for one ticket:
 * 1. Compute the ticket's brand/location impact (fails fast before any write)
 * 2. Embed the ticket once and match it against the most recently updated issues
 * 3. Link to the best match at or above 0.8, merging the impact and retrying on optimistic-lock conflicts
 * 4. Otherwise create a new issue that carries the ticket and its impact in a single write
 * 5. Hand brands that need an incident report to the report outbox
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IssueOrchestrator {

    static final double LINK_THRESHOLD = 0.8;
    static final double CREATED_CONFIDENCE = 1.0;
    static final int MAX_SIMILAR_ISSUES = 5;

    private final IssueRepository issueRepository;
    private final IssueMatcher issueMatcher;
    private final ImpactAggregator impactAggregator;
    private final TicketClassifier ticketClassifier;
    private final EmbeddingGateway embeddingGateway;
    private final ReportOutbox reportOutbox;
    private final ProcessingLogRecorder processingLogRecorder;
    private final IssueIntelligenceConfig config;

    public ProcessingResult processTicket(NormalizedTicket ticket) {
        if (ticket == null || ticket.getTicketId() == null || ticket.getTicketId().isBlank()) {
            throw new InvalidRequestException("ticketId is required");
        }
        long startTime = System.currentTimeMillis();
        log.info("Processing ticket {}: {}", ticket.getTicketId(), ticket.getTitle());

        try {
            ProcessingResult result = process(ticket);
            processingLogRecorder.recordSuccess(ticket, result, System.currentTimeMillis() - startTime);
            return result;
        } catch (IssueIntelligenceException e) {
            processingLogRecorder.recordFailure(ticket, e, System.currentTimeMillis() - startTime);
            throw e;
        } catch (DataAccessException e) {
            IssuePersistenceException failure =
                    new IssuePersistenceException("process ticket " + ticket.getTicketId(), e);
            processingLogRecorder.recordFailure(ticket, failure, System.currentTimeMillis() - startTime);
            throw failure;
        }
    }

    private ProcessingResult process(NormalizedTicket ticket) {
        BrandImpact impact = impactAggregator.computeImpact(ticket);
        double[] ticketEmbedding = embeddingGateway.tryEmbed(ticket.text()).orElse(null);

        List<Issue> candidates = issueRepository.findAllByOrderByUpdatedAtDesc(
                PageRequest.of(0, config.getCandidatePoolSize()));
        List<SimilarIssue> matches = issueMatcher.findMatches(
                ticket, ticketEmbedding, candidates, config.getMatchThreshold());
        log.info("Found {} similar issues for ticket {}", matches.size(), ticket.getTicketId());

        Optional<SimilarIssue> best = matches.stream().findFirst();
        ProcessingAction action;
        Issue updated;
        double confidence;

        if (best.isPresent() && best.get().score() >= LINK_THRESHOLD) {
            action = ProcessingAction.LINKED;
            updated = applyTicket(best.get().issue().getId(), ticket, impact);
            confidence = best.get().score();
        } else {
            action = ProcessingAction.CREATED;
            updated = createIssue(ticket, impact, ticketEmbedding);
            confidence = CREATED_CONFIDENCE;
        }

        String issueId = updated.getId();
        log.info("Ticket {} {} issue {} ({} members, {} brands, {} locations affected)",
                ticket.getTicketId(), action.value(), issueId,
                updated.getTotalAffectedMembers(), updated.getTotalAffectedBrands(),
                updated.getTotalAffectedLocations());

        List<String> triggered = triggerIncidentReports(updated);

        return ProcessingResult.builder()
                .action(action)
                .issueId(issueId)
                .confidence(confidence)
                .similarIssues(matches.stream()
                        .limit(MAX_SIMILAR_ISSUES)
                        .map(SimilarIssueSummary::from)
                        .toList())
                .incidentReportsTriggered(triggered)
                .build();
    }

    /**
     * The new issue is written once, already holding the ticket and its impact, so a failed
     * write leaves nothing behind for a redelivery to trip over.
     */
    private Issue createIssue(NormalizedTicket ticket, BrandImpact impact, double[] ticketEmbedding) {
        LocalDateTime now = LocalDateTime.now();
        Issue issue = Issue.builder()
                .id(UUID.randomUUID().toString())
                .title(ticket.getTitle())
                .description(ticket.getDescription())
                .status(IssueStatus.ACTIVE)
                .priority(ticketClassifier.derivePriority(ticket))
                .category(ticketClassifier.categorize(ticket))
                .linkedTicketIds(Set.of(ticket.getTicketId()))
                .tags(ticket.getTags())
                .brandImpacts(List.of(impact.copy()))
                .embedding(ticketEmbedding)
                .requiresIncidentReport(ticketClassifier.requiresIncidentReport(ticket))
                .createdAt(now)
                .updatedAt(now)
                .build();

        Issue saved = issueRepository.save(issue);
        log.info("Created issue {} ({}, {}) for ticket {}",
                saved.getId(), saved.getCategory(), saved.getPriority().value(), ticket.getTicketId());
        return saved;
    }

    /**
     * Links the ticket and merges its impact into the current persisted state of an existing issue.
     * Conflicting concurrent writers are detected by the issue version; the loser re-reads and re-merges.
     */
    Issue applyTicket(String issueId, NormalizedTicket ticket, BrandImpact impact) {
        int maxAttempts = Math.max(1, config.getMaxUpdateAttempts());
        for (int attempt = 1; ; attempt++) {
            Issue issue = issueRepository.findById(issueId)
                    .orElseThrow(() -> NotFoundException.issue(issueId));

            if (issue.isTicketLinked(ticket.getTicketId())) {
                log.info("Ticket {} already linked to issue {}, impact not re-applied",
                        ticket.getTicketId(), issueId);
                return issue;
            }

            issue.linkTicket(ticket.getTicketId());
            issue.addTags(ticket.getTags());
            impactAggregator.apply(issue, impact);
            issue.setUpdatedAt(LocalDateTime.now());

            try {
                return issueRepository.save(issue);
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= maxAttempts) {
                    throw IssuePersistenceException.concurrentUpdate(issueId, attempt, e);
                }
                log.warn("Concurrent update on issue {} (attempt {}/{}), retrying", issueId, attempt, maxAttempts);
            }
        }
    }

    boolean shouldGenerateIncidentReports(Issue issue) {
        return issue.isRequiresIncidentReport()
                || issue.getTotalAffectedMembers() >= config.getAutoReportThreshold()
                || issue.getPriority() == Priority.URGENT
                || issue.getBrandImpacts().stream().anyMatch(impact -> impact.getImpactLevel() == ImpactLevel.CRITICAL);
    }

    /**
     * Never fails the ticket: an outbox failure is logged and re-evaluated on the issue's next ticket.
     */
    private List<String> triggerIncidentReports(Issue issue) {
        if (!shouldGenerateIncidentReports(issue)) {
            return List.of();
        }

        List<String> brandIds = issue.getBrandImpacts().stream()
                .filter(impact -> impact.getTotalAffectedMembers() >= config.getAutoReportThreshold()
                        || impact.getImpactLevel() == ImpactLevel.CRITICAL)
                .map(BrandImpact::getBrandId)
                .filter(brandId -> !issue.hasIncidentReport(brandId))
                .toList();
        if (brandIds.isEmpty()) {
            return List.of();
        }

        try {
            List<String> enqueued = reportOutbox.enqueue(issue.getId(), brandIds);
            if (!enqueued.isEmpty()) {
                log.info("Incident reports triggered for issue {}, brands: {}", issue.getId(), enqueued);
            }
            return enqueued;
        } catch (RuntimeException e) {
            log.error("Failed to enqueue incident reports for issue {} (brands {}): {}",
                    issue.getId(), brandIds, e.getMessage());
            return List.of();
        }
    }
}
