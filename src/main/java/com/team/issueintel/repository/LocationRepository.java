package com.team.issueintel.repository;

import com.team.issueintel.model.entity.LocationReference;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LocationRepository extends JpaRepository<LocationReference, String> {

    Optional<LocationReference> findByIdAndBrandId(String id, String brandId);

    List<LocationReference> findByBrandId(String brandId);
}
