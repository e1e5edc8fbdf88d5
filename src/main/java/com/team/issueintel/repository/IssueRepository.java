package com.team.issueintel.repository;

import com.team.issueintel.model.IssueStatus;
import com.team.issueintel.model.entity.Issue;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface IssueRepository extends JpaRepository<Issue, String> {

    /** Most recently updated issues, used as the bounded candidate pool for matching */
    List<Issue> findAllByOrderByUpdatedAtDesc(Pageable pageable);

    long countByStatus(IssueStatus status);
}
