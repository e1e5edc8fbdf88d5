package com.team.issueintel.repository;

import com.team.issueintel.model.entity.ReportGenerationTask;
import com.team.issueintel.model.entity.ReportGenerationTask.TaskStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ReportGenerationTaskRepository extends JpaRepository<ReportGenerationTask, Long> {

    List<ReportGenerationTask> findByStatusOrderByCreatedAtAsc(TaskStatus status, Pageable pageable);

    boolean existsByIssueIdAndBrandIdAndStatusIn(String issueId, String brandId, Collection<TaskStatus> statuses);

    long countByStatus(TaskStatus status);
}
