package com.team.issueintel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Report sections as produced by the generative provider or by the fallback template,
 * before they are mapped onto an {@link com.team.issueintel.model.entity.IncidentReport}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedReport {

    private String title;
    private String summary;
    private String impactAnalysis;
    private List<String> affectedServices;
    private String timeline;
    private String currentStatus;
    private List<String> nextSteps;
    private String brandSpecificNotes;
    private String estimatedResolution;
    private boolean fallback;
}
