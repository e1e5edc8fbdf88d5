package com.team.issueintel.controller;

import com.team.issueintel.model.NormalizedTicket;
import com.team.issueintel.model.ProcessingResult;
import com.team.issueintel.service.issue.IssueOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Entry point for normalized ticket events.
 *
 * Example:
 * POST /api/tickets
 * {
 *   "ticketId": "HF-1042",
 *   "source": "happyfox",
 *   "title": "Mobile app login failure",
 *   "description": "Members cannot log in to the mobile app",
 *   "priority": "high",
 *   "customer": { "id": "c-1", "brandId": "hapana", "locationId": "gym-001", "tier": "premium" },
 *   "tags": ["login"]
 * }
 */
@RestController
@RequestMapping("/api/tickets")
@Slf4j
@RequiredArgsConstructor
public class TicketController {

    private final IssueOrchestrator orchestrator;

    @PostMapping
    public ResponseEntity<ProcessingResult> processTicket(@RequestBody NormalizedTicket ticket) {
        log.info("Ticket received: {}", ticket.getTicketId());
        return ResponseEntity.ok(orchestrator.processTicket(ticket));
    }
}
