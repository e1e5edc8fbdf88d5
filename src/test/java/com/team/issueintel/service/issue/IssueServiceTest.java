package com.team.issueintel.service.issue;

import com.team.issueintel.TestFixtures;
import com.team.issueintel.exception.InvalidStateTransitionException;
import com.team.issueintel.exception.NotFoundException;
import com.team.issueintel.model.IssueStatus;
import com.team.issueintel.model.entity.Issue;
import com.team.issueintel.repository.IssueRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("IssueService")
class IssueServiceTest {

    @Mock
    private IssueRepository issueRepository;

    private IssueService service;
    private Issue issue;

    @BeforeEach
    void setUp() {
        service = new IssueService(issueRepository);
        issue = TestFixtures.issue("issue-1", "Login fails", "");
        given(issueRepository.findById("issue-1")).willReturn(Optional.of(issue));
        given(issueRepository.save(any(Issue.class))).willAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("active and monitoring may alternate before resolving")
    void updateStatus_lifecycle() {
        assertThat(service.updateStatus("issue-1", IssueStatus.MONITORING).getStatus()).isEqualTo(IssueStatus.MONITORING);
        assertThat(service.updateStatus("issue-1", IssueStatus.ACTIVE).getStatus()).isEqualTo(IssueStatus.ACTIVE);
        assertThat(service.updateStatus("issue-1", IssueStatus.RESOLVED).getStatus()).isEqualTo(IssueStatus.RESOLVED);
    }

    @Test
    @DisplayName("resolved is terminal")
    void updateStatus_resolvedIsTerminal() {
        issue.setStatus(IssueStatus.RESOLVED);

        assertThatThrownBy(() -> service.updateStatus("issue-1", IssueStatus.ACTIVE))
                .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    @DisplayName("unknown issue is rejected")
    void getIssue_unknown() {
        given(issueRepository.findById("nope")).willReturn(Optional.empty());

        assertThatThrownBy(() -> service.getIssue("nope")).isInstanceOf(NotFoundException.class);
    }
}
