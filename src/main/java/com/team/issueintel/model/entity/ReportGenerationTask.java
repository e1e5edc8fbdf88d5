package com.team.issueintel.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Outbox row asking for an incident report for one (issue, brand).
 * Written while processing a ticket, drained by the report dispatcher.
 */
@Entity
@Table(name = "report_generation_task",
        indexes = @Index(name = "idx_task_status_created", columnList = "status, createdAt"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportGenerationTask {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String issueId;

    private String brandId;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;

    private int attempts;

    @Column(length = 2000)
    private String lastError;

    private String reportId;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public enum TaskStatus {
        PENDING, COMPLETED, FAILED
    }
}
