package com.team.issueintel.service.report;

import com.team.issueintel.config.IssueIntelligenceConfig;
import com.team.issueintel.exception.BrandNotAffectedException;
import com.team.issueintel.exception.IssuePersistenceException;
import com.team.issueintel.model.entity.IncidentReport;
import com.team.issueintel.model.entity.ReportGenerationTask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReportOutboxDispatcher")
class ReportOutboxDispatcherTest {

    @Mock
    private ReportOutbox outbox;

    @Mock
    private IncidentReportSynthesizer synthesizer;

    private IssueIntelligenceConfig config;
    private ReportOutboxDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        config = new IssueIntelligenceConfig();
        dispatcher = new ReportOutboxDispatcher(outbox, synthesizer, config);
    }

    @Test
    @DisplayName("successful generation completes the task with the report id")
    void dispatch_completes() {
        ReportGenerationTask task = task(1L);
        given(outbox.pending(config.getReportOutbox().getBatchSize())).willReturn(List.of(task));
        given(synthesizer.generate("issue-1", "hapana"))
                .willReturn(IncidentReport.builder().id("incident_1").build());

        dispatcher.dispatchPending();

        verify(outbox).markCompleted(task, "incident_1");
    }

    @Test
    @DisplayName("a transient failure uses up one attempt")
    void dispatch_transientFailure() {
        ReportGenerationTask task = task(2L);
        given(outbox.pending(anyInt())).willReturn(List.of(task));
        given(synthesizer.generate("issue-1", "hapana"))
                .willThrow(new IssuePersistenceException("save report", new DataAccessResourceFailureException("down")));

        dispatcher.dispatchPending();

        verify(outbox).markAttemptFailed(eq(task), anyString(), eq(config.getReportOutbox().getMaxAttempts()), eq(false));
        verify(outbox, never()).markCompleted(eq(task), anyString());
    }

    @Test
    @DisplayName("a brand with no impact fails the task permanently")
    void dispatch_brandNotAffected() {
        ReportGenerationTask task = task(3L);
        given(outbox.pending(anyInt())).willReturn(List.of(task));
        given(synthesizer.generate("issue-1", "hapana")).willThrow(new BrandNotAffectedException("hapana", "issue-1"));

        dispatcher.dispatchPending();

        verify(outbox).markAttemptFailed(eq(task), anyString(), anyInt(), eq(true));
    }

    @Test
    @DisplayName("one failing task does not stop the rest of the batch")
    void dispatch_continuesAfterFailure() {
        ReportGenerationTask failing = task(4L);
        ReportGenerationTask ok = ReportGenerationTask.builder().id(5L).issueId("issue-2").brandId("hapana").build();
        given(outbox.pending(anyInt())).willReturn(List.of(failing, ok));
        given(synthesizer.generate("issue-1", "hapana")).willThrow(new IllegalStateException("boom"));
        given(synthesizer.generate("issue-2", "hapana")).willReturn(IncidentReport.builder().id("incident_2").build());

        dispatcher.dispatchPending();

        verify(outbox).markCompleted(ok, "incident_2");
    }

    @Test
    @DisplayName("disabled outbox does nothing")
    void dispatch_disabled() {
        config.getReportOutbox().setEnabled(false);

        dispatcher.dispatchPending();

        verifyNoInteractions(outbox, synthesizer);
    }

    private static ReportGenerationTask task(Long id) {
        return ReportGenerationTask.builder().id(id).issueId("issue-1").brandId("hapana").build();
    }
}
