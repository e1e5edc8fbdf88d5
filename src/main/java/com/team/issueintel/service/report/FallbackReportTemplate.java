package com.team.issueintel.service.report;

import com.team.issueintel.model.BrandImpact;
import com.team.issueintel.model.GeneratedReport;
import com.team.issueintel.model.entity.Issue;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic report content built only from known issue and impact fields.
 * Used when the generative provider fails and to fill sections it left blank.
 */
@Component
public class FallbackReportTemplate {

    static final List<String> DEFAULT_NEXT_STEPS = List.of(
            "Monitor affected systems",
            "Communicate with affected members",
            "Implement resolution plan");

    public GeneratedReport build(Issue issue, String brandName, BrandImpact brandImpact) {
        int members = brandImpact.getTotalAffectedMembers();
        int locations = brandImpact.getLocationImpacts().size();
        String priority = issue.getPriority() != null ? issue.getPriority().value() : "unknown";

        return GeneratedReport.builder()
                .title("Incident Report - " + issue.getTitle())
                .summary("An incident has been detected affecting %s with %d members impacted."
                        .formatted(brandName, members))
                .impactAnalysis("This incident affects %d members across %d locations in %s."
                        .formatted(members, locations, brandName))
                .affectedServices(new ArrayList<>(brandImpact.getAffectedServices()))
                .timeline("Issue first detected: " + issue.getCreatedAt())
                .currentStatus("Issue is currently %s with priority level %s."
                        .formatted(issue.getStatus().value(), priority))
                .nextSteps(DEFAULT_NEXT_STEPS)
                .brandSpecificNotes("This incident specifically affects %s operations.".formatted(brandName))
                .estimatedResolution(null)
                .fallback(true)
                .build();
    }

    /**
     * Keeps every generated section that has content and takes the rest from the fallback.
     */
    public GeneratedReport fillBlanks(GeneratedReport generated, GeneratedReport fallback) {
        return GeneratedReport.builder()
                .title(orElse(generated.getTitle(), fallback.getTitle()))
                .summary(orElse(generated.getSummary(), fallback.getSummary()))
                .impactAnalysis(orElse(generated.getImpactAnalysis(), fallback.getImpactAnalysis()))
                .affectedServices(isEmpty(generated.getAffectedServices())
                        ? fallback.getAffectedServices() : generated.getAffectedServices())
                .timeline(orElse(generated.getTimeline(), fallback.getTimeline()))
                .currentStatus(orElse(generated.getCurrentStatus(), fallback.getCurrentStatus()))
                .nextSteps(isEmpty(generated.getNextSteps()) ? fallback.getNextSteps() : generated.getNextSteps())
                .brandSpecificNotes(orElse(generated.getBrandSpecificNotes(), fallback.getBrandSpecificNotes()))
                .estimatedResolution(generated.getEstimatedResolution())
                .fallback(false)
                .build();
    }

    private static String orElse(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }

    private static boolean isEmpty(List<String> values) {
        return values == null || values.isEmpty();
    }
}
