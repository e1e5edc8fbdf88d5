package com.team.issueintel.repository;

import com.team.issueintel.model.entity.BrandReference;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BrandRepository extends JpaRepository<BrandReference, String> {
}
