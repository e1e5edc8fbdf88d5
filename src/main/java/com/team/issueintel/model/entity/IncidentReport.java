package com.team.issueintel.model.entity;

import com.team.issueintel.model.ImpactLevel;
import com.team.issueintel.model.ReportStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Brand-specific incident report generated for an issue. One per (issue, brand).
 */
@Entity
@Table(name = "incident_report",
        uniqueConstraints = @UniqueConstraint(name = "uk_report_issue_brand", columnNames = {"issueId", "brandId"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentReport {

    public static final String GENERATED_BY_AI = "ai-assistant";
    public static final String GENERATED_BY_TEMPLATE = "template-fallback";

    @Id
    private String id;

    private String issueId;

    private String brandId;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private ReportStatus status = ReportStatus.DRAFT;

    private LocalDateTime generatedAt;

    /** "ai-assistant" or "template-fallback" */
    private String generatedBy;

    @Embedded
    private Content content;

    @Embedded
    private Metadata metadata;

    private LocalDateTime publishedAt;

    @Embeddable
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Content {
        private String title;
        @Column(length = 4000)
        private String summary;
        @Column(length = 4000)
        private String impactAssessment;
        @Column(length = 4000)
        private String timeline;
        @Column(length = 4000)
        private String rootCause;
        @Column(length = 4000)
        private String resolution;
        @Column(length = 4000)
        private String preventiveMeasures;
        @Column(length = 4000)
        private String communicationPlan;
    }

    /**
     * Snapshot of the brand's impact when the report was generated.
     */
    @Embeddable
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {
        private int totalAffectedMembers;
        private int affectedLocations;
        private String estimatedDowntime;
        @Enumerated(EnumType.STRING)
        private ImpactLevel businessImpact;
        private String customerSegments;
    }
}
