package com.team.issueintel.model.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.team.issueintel.model.BrandImpact;
import com.team.issueintel.model.IssueStatus;
import com.team.issueintel.model.Priority;
import com.team.issueintel.model.entity.converter.BrandImpactListConverter;
import com.team.issueintel.model.entity.converter.EmbeddingConverter;
import com.team.issueintel.model.entity.converter.StringMapConverter;
import com.team.issueintel.model.entity.converter.StringSetConverter;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One real-world operational problem, possibly reported through many tickets
 * across brands and locations.
 *
 * The brand impacts are stored as an embedded JSON document. The three totals are
 * persisted for querying but only ever derived from {@link #brandImpacts}.
 */
@Entity
@Table(name = "issue", indexes = @Index(name = "idx_issue_updated_at", columnList = "updatedAt"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Issue {

    @Id
    private String id;

    @Setter
    private String title;

    @Setter
    @Column(length = 8000)
    private String description;

    @Setter
    @Enumerated(EnumType.STRING)
    private IssueStatus status;

    @Setter
    @Enumerated(EnumType.STRING)
    private Priority priority;

    @Setter
    private String category;

    /** Upstream ticket ids from any source system */
    @Lob
    @Convert(converter = StringSetConverter.class)
    private Set<String> linkedTicketIds = new LinkedHashSet<>();

    @Lob
    @Convert(converter = StringSetConverter.class)
    private Set<String> tags = new LinkedHashSet<>();

    @Lob
    @Convert(converter = BrandImpactListConverter.class)
    private List<BrandImpact> brandImpacts = new ArrayList<>();

    private int totalAffectedMembers;
    private int totalAffectedBrands;
    private int totalAffectedLocations;

    /** Cached embedding of title + description; null until first computed */
    @Setter
    @JsonIgnore
    @Lob
    @Convert(converter = EmbeddingConverter.class)
    private double[] embedding;

    @Setter
    private boolean requiresIncidentReport;

    /** brandId → incident report id */
    @Lob
    @Convert(converter = StringMapConverter.class)
    private Map<String, String> incidentReports = new LinkedHashMap<>();

    private LocalDateTime createdAt;

    @Setter
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    @Builder
    private Issue(String id, String title, String description, IssueStatus status, Priority priority,
                  String category, Set<String> linkedTicketIds, Set<String> tags,
                  List<BrandImpact> brandImpacts, double[] embedding, boolean requiresIncidentReport,
                  Map<String, String> incidentReports, LocalDateTime createdAt, LocalDateTime updatedAt) {
        this.id = id;
        this.title = title;
        this.description = description;
        this.status = status != null ? status : IssueStatus.ACTIVE;
        this.priority = priority;
        this.category = category;
        this.linkedTicketIds = linkedTicketIds != null ? new LinkedHashSet<>(linkedTicketIds) : new LinkedHashSet<>();
        this.tags = tags != null ? new LinkedHashSet<>(tags) : new LinkedHashSet<>();
        this.embedding = embedding;
        this.requiresIncidentReport = requiresIncidentReport;
        this.incidentReports = incidentReports != null ? new LinkedHashMap<>(incidentReports) : new LinkedHashMap<>();
        this.createdAt = createdAt;
        this.updatedAt = updatedAt != null ? updatedAt : createdAt;
        replaceBrandImpacts(brandImpacts != null ? brandImpacts : List.of());
    }

    public String text() {
        return (title != null ? title : "") + " " + (description != null ? description : "");
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    public boolean isResolved() {
        return status == IssueStatus.RESOLVED;
    }

    /**
     * @return true if the ticket was not linked before
     */
    public boolean linkTicket(String ticketId) {
        Set<String> updated = new LinkedHashSet<>(linkedTicketIds);
        boolean added = updated.add(ticketId);
        linkedTicketIds = updated;
        return added;
    }

    public boolean isTicketLinked(String ticketId) {
        return linkedTicketIds.contains(ticketId);
    }

    public Optional<BrandImpact> findBrandImpact(String brandId) {
        return brandImpacts.stream()
                .filter(impact -> impact.getBrandId().equals(brandId))
                .findFirst();
    }

    /**
     * Swaps in a new impact ledger and re-derives the issue totals from it.
     */
    public void replaceBrandImpacts(List<BrandImpact> impacts) {
        this.brandImpacts = new ArrayList<>(impacts);
        this.totalAffectedMembers = impacts.stream().mapToInt(BrandImpact::getTotalAffectedMembers).sum();
        this.totalAffectedBrands = impacts.size();
        this.totalAffectedLocations = impacts.stream().mapToInt(impact -> impact.getLocationImpacts().size()).sum();
    }

    public void recordIncidentReport(String brandId, String reportId) {
        Map<String, String> updated = new LinkedHashMap<>(incidentReports);
        updated.put(brandId, reportId);
        incidentReports = updated;
    }

    public boolean hasIncidentReport(String brandId) {
        return incidentReports.containsKey(brandId);
    }

    public void addTags(Set<String> newTags) {
        if (newTags == null || newTags.isEmpty()) return;
        Set<String> updated = new LinkedHashSet<>(tags);
        updated.addAll(newTags);
        tags = updated;
    }
}
