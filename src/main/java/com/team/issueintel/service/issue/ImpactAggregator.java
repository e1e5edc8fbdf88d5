package com.team.issueintel.service.issue;

import com.team.issueintel.exception.ResolutionException;
import com.team.issueintel.model.BrandImpact;
import com.team.issueintel.model.LocationImpact;
import com.team.issueintel.model.NormalizedTicket;
import com.team.issueintel.model.entity.BrandReference;
import com.team.issueintel.model.entity.Issue;
import com.team.issueintel.model.entity.LocationReference;
import com.team.issueintel.repository.BrandRepository;
import com.team.issueintel.repository.LocationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Computes the organizational impact of a single ticket and merges it into an issue's impact ledger.
 *
 * A freshly computed impact is always one member at one location. Merging never mutates its inputs,
 * so a merge can be replayed against a re-read issue after an optimistic-lock conflict.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ImpactAggregator {

    static final String UNKNOWN_BRAND = "Unknown Brand";

    private final BrandRepository brandRepository;
    private final LocationRepository locationRepository;
    private final TicketClassifier ticketClassifier;

    /**
     * @throws ResolutionException if the ticket's location cannot be resolved for its brand
     */
    public BrandImpact computeImpact(NormalizedTicket ticket) {
        NormalizedTicket.Customer customer = ticket.getCustomer();
        if (customer == null || customer.getBrandId() == null || customer.getLocationId() == null) {
            throw new ResolutionException("brand/location of ticket " + ticket.getTicketId());
        }
        String brandId = customer.getBrandId();

        LocationReference location = locationRepository.findByIdAndBrandId(customer.getLocationId(), brandId)
                .orElseThrow(() -> new ResolutionException(
                        "location " + customer.getLocationId() + " of brand " + brandId));

        String brandName = brandRepository.findById(brandId)
                .map(BrandReference::getName)
                .orElseGet(() -> {
                    log.warn("Brand {} has no reference record, using placeholder name", brandId);
                    return UNKNOWN_BRAND;
                });

        List<String> services = ticketClassifier.affectedServices(ticket);
        LocationImpact locationImpact = LocationImpact.of(
                location.getId(), location.getName(), brandId, 1, location.getMemberCount(), services);

        BrandImpact impact = BrandImpact.builder()
                .brandId(brandId)
                .brandName(brandName)
                .locationImpacts(new ArrayList<>(List.of(locationImpact)))
                .affectedServices(new ArrayList<>(services))
                .build();
        impact.recalculate();
        return impact;
    }

    /**
     * Merges a newly computed brand impact into a copy of the existing ledger.
     * A location already tracked gains exactly one affected member; an unknown location is appended.
     */
    public List<BrandImpact> merge(List<BrandImpact> existing, BrandImpact newImpact) {
        List<BrandImpact> merged = new ArrayList<>(existing.stream().map(BrandImpact::copy).toList());

        Optional<BrandImpact> match = merged.stream()
                .filter(impact -> impact.getBrandId().equals(newImpact.getBrandId()))
                .findFirst();

        if (match.isEmpty()) {
            merged.add(newImpact.copy());
            return merged;
        }

        BrandImpact target = match.get();
        for (LocationImpact incoming : newImpact.getLocationImpacts()) {
            Optional<LocationImpact> known = target.findLocation(incoming.getLocationId());
            if (known.isPresent()) {
                LocationImpact location = known.get();
                location.addAffectedMember();
                location.setAffectedServices(union(location.getAffectedServices(), incoming.getAffectedServices()));
            } else {
                target.getLocationImpacts().add(incoming.copy());
            }
        }
        target.setAffectedServices(union(target.getAffectedServices(), newImpact.getAffectedServices()));
        target.recalculate();
        return merged;
    }

    /**
     * Merges the impact into the issue and re-derives the issue totals.
     */
    public void apply(Issue issue, BrandImpact newImpact) {
        issue.replaceBrandImpacts(merge(issue.getBrandImpacts(), newImpact));
    }

    private static List<String> union(List<String> first, List<String> second) {
        Set<String> union = new LinkedHashSet<>(first);
        union.addAll(second);
        return new ArrayList<>(union);
    }
}
