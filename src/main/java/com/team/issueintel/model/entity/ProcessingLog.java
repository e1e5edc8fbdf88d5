package com.team.issueintel.model.entity;

import com.team.issueintel.model.ProcessingAction;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Audit row for one ticket-processing run.
 */
@Entity
@Table(name = "processing_log")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String ticketId;

    private String issueId;

    @Enumerated(EnumType.STRING)
    private ProcessingAction action;

    @Enumerated(EnumType.STRING)
    private Outcome outcome;

    private long processingTimeMs;

    private int similarIssuesFound;

    private double confidence;

    @Column(length = 2000)
    private String error;

    private LocalDateTime timestamp;

    public enum Outcome {
        SUCCESS, ERROR
    }
}
