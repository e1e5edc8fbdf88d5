package com.team.issueintel.service.issue;

import com.team.issueintel.exception.InvalidStateTransitionException;
import com.team.issueintel.exception.IssuePersistenceException;
import com.team.issueintel.exception.NotFoundException;
import com.team.issueintel.model.IssueStatus;
import com.team.issueintel.model.entity.Issue;
import com.team.issueintel.repository.IssueRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Issue reads and lifecycle transitions.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IssueService {

    private final IssueRepository issueRepository;

    public Issue getIssue(String issueId) {
        return issueRepository.findById(issueId)
                .orElseThrow(() -> NotFoundException.issue(issueId));
    }

    public Issue updateStatus(String issueId, IssueStatus target) {
        Issue issue = getIssue(issueId);
        if (!issue.getStatus().canTransitionTo(target)) {
            throw new InvalidStateTransitionException("issue " + issueId, issue.getStatus().value(),
                    target != null ? target.value() : null);
        }
        issue.setStatus(target);
        issue.setUpdatedAt(LocalDateTime.now());
        try {
            Issue saved = issueRepository.save(issue);
            log.info("Issue {} moved to {}", issueId, target.value());
            return saved;
        } catch (OptimisticLockingFailureException e) {
            throw IssuePersistenceException.concurrentUpdate(issueId, 1, e);
        }
    }
}
