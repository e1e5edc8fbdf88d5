package com.team.issueintel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Priority {
    LOW, MEDIUM, HIGH, URGENT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parsing for upstream priority labels such as "Urgent" or "2 - High".
     * Unknown or missing labels map to MEDIUM.
     */
    @JsonCreator
    public static Priority from(String label) {
        if (label == null || label.isBlank()) return MEDIUM;
        String upper = label.trim().toUpperCase(Locale.ROOT);
        try {
            return Priority.valueOf(upper);
        } catch (IllegalArgumentException e) {
            if (upper.contains("URGENT")) return URGENT;
            if (upper.contains("HIGH")) return HIGH;
            if (upper.contains("LOW")) return LOW;
            return MEDIUM;
        }
    }
}
