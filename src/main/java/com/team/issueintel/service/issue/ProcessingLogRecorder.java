package com.team.issueintel.service.issue;

import com.team.issueintel.model.NormalizedTicket;
import com.team.issueintel.model.ProcessingResult;
import com.team.issueintel.model.entity.ProcessingLog;
import com.team.issueintel.model.entity.ProcessingLog.Outcome;
import com.team.issueintel.repository.ProcessingLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Writes one audit row per processed ticket. Failures here never affect the ticket outcome.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProcessingLogRecorder {

    private final ProcessingLogRepository processingLogRepository;

    public void recordSuccess(NormalizedTicket ticket, ProcessingResult result, long processingTimeMs) {
        save(ProcessingLog.builder()
                .ticketId(ticket.getTicketId())
                .issueId(result.getIssueId())
                .action(result.getAction())
                .outcome(Outcome.SUCCESS)
                .processingTimeMs(processingTimeMs)
                .similarIssuesFound(result.getSimilarIssues() != null ? result.getSimilarIssues().size() : 0)
                .confidence(result.getConfidence())
                .timestamp(LocalDateTime.now())
                .build());
    }

    public void recordFailure(NormalizedTicket ticket, Exception error, long processingTimeMs) {
        save(ProcessingLog.builder()
                .ticketId(ticket.getTicketId())
                .outcome(Outcome.ERROR)
                .processingTimeMs(processingTimeMs)
                .error(truncate(error.getMessage()))
                .timestamp(LocalDateTime.now())
                .build());
    }

    private void save(ProcessingLog entry) {
        try {
            processingLogRepository.save(entry);
        } catch (Exception e) {
            log.warn("Failed to record processing log for ticket {} (ignored): {}", entry.getTicketId(), e.getMessage());
        }
    }

    private static String truncate(String message) {
        if (message == null) return null;
        return message.length() > 2000 ? message.substring(0, 2000) : message;
    }
}
