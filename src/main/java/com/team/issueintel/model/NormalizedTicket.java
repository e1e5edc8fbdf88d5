package com.team.issueintel.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * A support ticket event translated from any upstream ticketing system into one canonical shape.
 * Per-source adapters (HappyFox, Jira, ...) produce this; everything downstream only sees this type.
 */
@Value
@Builder
@Jacksonized
public class NormalizedTicket {

    String ticketId;

    /** Upstream system name, e.g. "happyfox" or "jira" */
    String source;

    String title;
    String description;
    String status;
    Priority priority;
    Customer customer;
    LocalDateTime created;
    LocalDateTime updated;

    @Singular
    Set<String> tags;

    /**
     * Title and description joined the way every similarity and classification step reads a ticket.
     */
    public String text() {
        return (title != null ? title : "") + " " + (description != null ? description : "");
    }

    @Value
    @Builder
    @Jacksonized
    public static class Customer {
        String id;
        String brandId;
        String locationId;
        CustomerTier tier;
    }
}
