package com.team.issueintel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Impact of an issue on one brand. Totals, level and services are derived from
 * {@link #locationImpacts} by {@link #recalculate()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BrandImpact {

    private String brandId;
    private String brandName;
    private int totalAffectedMembers;
    private ImpactLevel impactLevel;

    @Builder.Default
    private List<LocationImpact> locationImpacts = new ArrayList<>();

    @Builder.Default
    private List<String> affectedServices = new ArrayList<>();

    public Optional<LocationImpact> findLocation(String locationId) {
        return locationImpacts.stream()
                .filter(location -> location.getLocationId().equals(locationId))
                .findFirst();
    }

    public void recalculate() {
        totalAffectedMembers = locationImpacts.stream().mapToInt(LocationImpact::getAffectedMembers).sum();
        impactLevel = ImpactLevel.highest(locationImpacts.stream().map(LocationImpact::getImpactLevel).toList());

        Set<String> services = new LinkedHashSet<>(affectedServices);
        locationImpacts.forEach(location -> services.addAll(location.getAffectedServices()));
        affectedServices = new ArrayList<>(services);
    }

    public BrandImpact copy() {
        return BrandImpact.builder()
                .brandId(brandId)
                .brandName(brandName)
                .totalAffectedMembers(totalAffectedMembers)
                .impactLevel(impactLevel)
                .locationImpacts(new ArrayList<>(locationImpacts.stream().map(LocationImpact::copy).toList()))
                .affectedServices(new ArrayList<>(affectedServices))
                .build();
    }
}
