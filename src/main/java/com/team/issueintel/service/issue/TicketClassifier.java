package com.team.issueintel.service.issue;

import com.team.issueintel.model.NormalizedTicket;
import com.team.issueintel.model.Priority;
import com.team.issueintel.util.TextPreprocessor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keyword rules that derive an issue's priority, category and affected services from a ticket.
 * Matching is on whole words of title + description.
 */
@Component
public class TicketClassifier {

    static final List<String> URGENT_KEYWORDS = List.of("down", "outage", "critical", "emergency", "broken");

    static final String DEFAULT_CATEGORY = "general";

    private static final Map<String, List<String>> CATEGORY_KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, List<String>> SERVICE_KEYWORDS = new LinkedHashMap<>();

    static {
        // First matching category wins
        CATEGORY_KEYWORDS.put("authentication", List.of("login", "password", "access"));
        CATEGORY_KEYWORDS.put("billing", List.of("payment", "billing", "charge"));
        CATEGORY_KEYWORDS.put("technical", List.of("app", "mobile", "website"));
        CATEGORY_KEYWORDS.put("booking", List.of("class", "booking", "schedule"));

        SERVICE_KEYWORDS.put("mobile_app", List.of("app", "mobile"));
        SERVICE_KEYWORDS.put("website", List.of("website", "web"));
        SERVICE_KEYWORDS.put("class_booking", List.of("class", "booking"));
        SERVICE_KEYWORDS.put("payment_system", List.of("payment", "billing"));
        SERVICE_KEYWORDS.put("facility_access", List.of("access", "entry"));
    }

    public boolean hasUrgentKeywords(NormalizedTicket ticket) {
        return TextPreprocessor.containsAny(TextPreprocessor.words(ticket.text()), URGENT_KEYWORDS);
    }

    /**
     * URGENT when the ticket already is, or when urgent keywords appear; otherwise the ticket's own priority.
     */
    public Priority derivePriority(NormalizedTicket ticket) {
        Priority ticketPriority = ticket.getPriority() != null ? ticket.getPriority() : Priority.MEDIUM;
        if (ticketPriority == Priority.URGENT || hasUrgentKeywords(ticket)) {
            return Priority.URGENT;
        }
        return ticketPriority;
    }

    public String categorize(NormalizedTicket ticket) {
        Set<String> words = TextPreprocessor.words(ticket.text());
        return CATEGORY_KEYWORDS.entrySet().stream()
                .filter(entry -> TextPreprocessor.containsAny(words, entry.getValue()))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(DEFAULT_CATEGORY);
    }

    public boolean requiresIncidentReport(NormalizedTicket ticket) {
        return ticket.getPriority() == Priority.URGENT || hasUrgentKeywords(ticket);
    }

    public List<String> affectedServices(NormalizedTicket ticket) {
        Set<String> words = TextPreprocessor.words(ticket.text());
        List<String> services = new ArrayList<>();
        SERVICE_KEYWORDS.forEach((service, keywords) -> {
            if (TextPreprocessor.containsAny(words, keywords)) {
                services.add(service);
            }
        });
        return services;
    }
}
