package com.team.issueintel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Affected members at one physical location of one brand.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LocationImpact {

    private String locationId;
    private String locationName;
    private String brandId;
    private int affectedMembers;
    private int totalMembers;
    private double impactPercentage;
    private ImpactLevel impactLevel;

    @Builder.Default
    private List<String> affectedServices = new ArrayList<>();

    public static LocationImpact of(String locationId, String locationName, String brandId,
                                    int affectedMembers, int totalMembers, List<String> affectedServices) {
        LocationImpact impact = LocationImpact.builder()
                .locationId(locationId)
                .locationName(locationName)
                .brandId(brandId)
                .affectedMembers(affectedMembers)
                .totalMembers(totalMembers)
                .affectedServices(new ArrayList<>(affectedServices))
                .build();
        impact.recalculate();
        return impact;
    }

    /**
     * One more reporter at this location.
     */
    public void addAffectedMember() {
        affectedMembers++;
        recalculate();
    }

    /**
     * Recomputes percentage and level from the member counts. An unknown location size
     * (totalMembers <= 0) counts as 0%.
     */
    public void recalculate() {
        impactPercentage = totalMembers > 0 ? (double) affectedMembers / totalMembers * 100 : 0.0;
        impactLevel = ImpactLevel.fromPercentage(impactPercentage);
    }

    public LocationImpact copy() {
        return toBuilder()
                .affectedServices(new ArrayList<>(affectedServices != null ? affectedServices : List.of()))
                .build();
    }
}
