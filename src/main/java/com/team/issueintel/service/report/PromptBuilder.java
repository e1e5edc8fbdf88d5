package com.team.issueintel.service.report;

import com.team.issueintel.model.BrandImpact;
import com.team.issueintel.model.entity.BrandReference;
import com.team.issueintel.model.entity.Issue;
import com.team.issueintel.model.entity.TicketRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the incident report prompt from an external template file.
 * The template lives in src/main/resources/prompts/ and can be
 * edited without recompiling the application.
 */
@Component
@Slf4j
public class PromptBuilder {

    static final String TEMPLATE_PATH = "prompts/incident-report.txt";

    private String template;

    @PostConstruct
    public void loadTemplates() {
        try {
            ClassPathResource resource = new ClassPathResource(TEMPLATE_PATH);
            template = new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            log.info("Loaded incident report prompt template from {}", TEMPLATE_PATH);
        } catch (IOException e) {
            log.warn("Could not load prompt template '{}', using built-in default: {}", TEMPLATE_PATH, e.getMessage());
        }
    }

    /**
     * Build the prompt for one brand's incident report.
     *
     * @param issue       the issue being reported on
     * @param brand       brand reference, or null when the brand is not in the reference data
     * @param brandImpact the brand's impact record on the issue
     * @param tickets     summaries of the linked tickets that could be resolved
     * @return complete prompt string for the generative provider
     */
    public String buildIncidentReportPrompt(Issue issue, BrandReference brand, BrandImpact brandImpact,
                                            List<TicketRecord> tickets) {
        String source = template != null ? template : getDefaultIncidentReportTemplate();
        return source
                .replace("{{ISSUE_CONTEXT}}", issueContext(issue))
                .replace("{{BRAND_CONTEXT}}", brandContext(brand, brandImpact))
                .replace("{{IMPACT_CONTEXT}}", impactContext(brandImpact))
                .replace("{{TICKETS_CONTEXT}}", ticketsContext(tickets))
                .replace("{{TECHNICAL_CONTEXT}}", technicalContext(issue));
    }

    private String issueContext(Issue issue) {
        return """
                Title: %s
                Description: %s
                Priority: %s
                Status: %s
                Category: %s
                Total Affected Brands: %d
                Total Affected Members: %d
                Created: %s""".formatted(
                issue.getTitle(),
                issue.getDescription(),
                issue.getPriority() != null ? issue.getPriority().value() : "unknown",
                issue.getStatus().value(),
                issue.getCategory(),
                issue.getTotalAffectedBrands(),
                issue.getTotalAffectedMembers(),
                issue.getCreatedAt());
    }

    private String brandContext(BrandReference brand, BrandImpact brandImpact) {
        if (brand == null) {
            return "Brand: " + brandImpact.getBrandName() + " (no reference data)";
        }
        return """
                Brand: %s (%s)
                Region: %s
                Total Members: %d""".formatted(brand.getName(), brand.getCode(), brand.getRegion(), brand.getMemberCount());
    }

    private String impactContext(BrandImpact brandImpact) {
        return """
                Affected Members in Brand: %d
                Affected Locations: %d
                Impact Level: %s
                Affected Services: %s""".formatted(
                brandImpact.getTotalAffectedMembers(),
                brandImpact.getLocationImpacts().size(),
                brandImpact.getImpactLevel().value(),
                brandImpact.getAffectedServices().isEmpty() ? "Unknown" : String.join(", ", brandImpact.getAffectedServices()));
    }

    private String ticketsContext(List<TicketRecord> tickets) {
        if (tickets.isEmpty()) {
            return "No ticket details available";
        }
        return "Tickets (" + tickets.size() + "):\n" + tickets.stream()
                .map(ticket -> "- %s [%s] %s: %s (Priority: %s)".formatted(
                        ticket.getTicketId(), ticket.getSource(), ticket.getTitle(),
                        ticket.getStatus(), ticket.getPriority()))
                .collect(Collectors.joining("\n"));
    }

    private String technicalContext(Issue issue) {
        return "Tags: " + String.join(", ", issue.getTags()) + "\n"
                + "Requires Incident Report: " + issue.isRequiresIncidentReport();
    }

    private String getDefaultIncidentReportTemplate() {
        return """
                You are an expert incident report writer for fitness/wellness brands. Generate an incident report based on the following information.

                ## Issue Details
                {{ISSUE_CONTEXT}}

                ## Brand Information
                {{BRAND_CONTEXT}}

                ## Impact Analysis
                {{IMPACT_CONTEXT}}

                ## Customer Tickets
                {{TICKETS_CONTEXT}}

                ## Technical Details
                {{TECHNICAL_CONTEXT}}

                Respond in the following JSON format:
                ```json
                {
                  "title": "Brief descriptive title",
                  "summary": "Executive summary, 2-3 sentences",
                  "impactAnalysis": "Breakdown of affected members, locations and services",
                  "affectedServices": ["service"],
                  "timeline": "Chronological timeline",
                  "currentStatus": "Current situation",
                  "nextSteps": ["action item"],
                  "brandSpecificNotes": "Considerations for this brand",
                  "estimatedResolution": "Time estimate, optional"
                }
                ```
                """;
    }
}
