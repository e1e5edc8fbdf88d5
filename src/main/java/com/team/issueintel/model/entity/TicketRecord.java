package com.team.issueintel.model.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Summary of an upstream ticket, kept by the sync layer. Read here for report context only.
 */
@Entity
@Table(name = "ticket_record")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketRecord {

    @Id
    private String ticketId;

    private String source;

    private String title;

    private String status;

    private String priority;

    private String brandId;

    private String locationId;

    private LocalDateTime created;
}
