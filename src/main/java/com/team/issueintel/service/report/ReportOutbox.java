package com.team.issueintel.service.report;

import com.team.issueintel.exception.InvalidStateTransitionException;
import com.team.issueintel.exception.NotFoundException;
import com.team.issueintel.model.entity.ReportGenerationTask;
import com.team.issueintel.model.entity.ReportGenerationTask.TaskStatus;
import com.team.issueintel.repository.ReportGenerationTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Hand-off point between ticket processing and report generation.
 * A task per (issue, brand) is written here and drained by {@link ReportOutboxDispatcher}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReportOutbox {

    private static final EnumSet<TaskStatus> OPEN_OR_DONE = EnumSet.of(TaskStatus.PENDING, TaskStatus.COMPLETED);
    private static final int MAX_LISTED_TASKS = 200;

    private final ReportGenerationTaskRepository taskRepository;

    /**
     * @return the brand ids a new task was written for; brands with a pending or completed task are skipped
     */
    public List<String> enqueue(String issueId, List<String> brandIds) {
        List<String> enqueued = new ArrayList<>();
        LocalDateTime now = LocalDateTime.now();
        for (String brandId : brandIds) {
            if (taskRepository.existsByIssueIdAndBrandIdAndStatusIn(issueId, brandId, OPEN_OR_DONE)) {
                log.debug("Report task for issue {}, brand {} already queued", issueId, brandId);
                continue;
            }
            taskRepository.save(ReportGenerationTask.builder()
                    .issueId(issueId)
                    .brandId(brandId)
                    .status(TaskStatus.PENDING)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
            enqueued.add(brandId);
        }
        return enqueued;
    }

    public List<ReportGenerationTask> pending(int batchSize) {
        return taskRepository.findByStatusOrderByCreatedAtAsc(TaskStatus.PENDING, PageRequest.of(0, batchSize));
    }

    public List<ReportGenerationTask> listTasks(TaskStatus status) {
        if (status != null) {
            return taskRepository.findByStatusOrderByCreatedAtAsc(status, PageRequest.of(0, MAX_LISTED_TASKS));
        }
        return taskRepository.findAll(PageRequest.of(0, MAX_LISTED_TASKS, Sort.by("createdAt"))).getContent();
    }

    /**
     * Puts a failed task back in the queue with a fresh attempt budget.
     */
    public ReportGenerationTask retry(Long taskId) {
        ReportGenerationTask task = taskRepository.findById(taskId)
                .orElseThrow(() -> NotFoundException.task(taskId));
        if (task.getStatus() != TaskStatus.FAILED) {
            throw new InvalidStateTransitionException("report task " + taskId, task.getStatus(), TaskStatus.PENDING);
        }
        task.setStatus(TaskStatus.PENDING);
        task.setAttempts(0);
        task.setLastError(null);
        task.setUpdatedAt(LocalDateTime.now());
        log.info("Report task {} (issue {}, brand {}) re-queued", taskId, task.getIssueId(), task.getBrandId());
        return taskRepository.save(task);
    }

    public void markCompleted(ReportGenerationTask task, String reportId) {
        task.setStatus(TaskStatus.COMPLETED);
        task.setReportId(reportId);
        task.setAttempts(task.getAttempts() + 1);
        task.setLastError(null);
        task.setUpdatedAt(LocalDateTime.now());
        taskRepository.save(task);
    }

    /**
     * Records a failed attempt; the task stays pending until {@code maxAttempts} is reached.
     *
     * @param permanent fail immediately regardless of the remaining attempts
     */
    public void markAttemptFailed(ReportGenerationTask task, String error, int maxAttempts, boolean permanent) {
        int attempts = task.getAttempts() + 1;
        task.setAttempts(attempts);
        task.setLastError(error != null && error.length() > 2000 ? error.substring(0, 2000) : error);
        task.setStatus(permanent || attempts >= maxAttempts ? TaskStatus.FAILED : TaskStatus.PENDING);
        task.setUpdatedAt(LocalDateTime.now());
        taskRepository.save(task);
    }
}
