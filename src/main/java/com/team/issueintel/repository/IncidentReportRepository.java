package com.team.issueintel.repository;

import com.team.issueintel.model.entity.IncidentReport;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface IncidentReportRepository extends JpaRepository<IncidentReport, String> {

    List<IncidentReport> findByIssueIdOrderByGeneratedAtDesc(String issueId);

    Optional<IncidentReport> findByIssueIdAndBrandId(String issueId, String brandId);
}
