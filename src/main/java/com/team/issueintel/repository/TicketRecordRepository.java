package com.team.issueintel.repository;

import com.team.issueintel.model.entity.TicketRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TicketRecordRepository extends JpaRepository<TicketRecord, String> {
}
