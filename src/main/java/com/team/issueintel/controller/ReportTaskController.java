package com.team.issueintel.controller;

import com.team.issueintel.exception.InvalidRequestException;
import com.team.issueintel.model.entity.ReportGenerationTask;
import com.team.issueintel.model.entity.ReportGenerationTask.TaskStatus;
import com.team.issueintel.service.report.ReportOutbox;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/report-tasks")
@RequiredArgsConstructor
public class ReportTaskController {

    private final ReportOutbox outbox;

    @GetMapping
    public ResponseEntity<List<ReportGenerationTask>> listTasks(@RequestParam(required = false) String status) {
        return ResponseEntity.ok(outbox.listTasks(parseStatus(status)));
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<ReportGenerationTask> retry(@PathVariable Long id) {
        return ResponseEntity.ok(outbox.retry(id));
    }

    private TaskStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return TaskStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("unknown task status '" + status + "'");
        }
    }
}
