package com.team.issueintel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Issue lifecycle. ACTIVE and MONITORING may alternate; RESOLVED is terminal.
 */
public enum IssueStatus {
    ACTIVE, MONITORING, RESOLVED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IssueStatus from(String value) {
        return IssueStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean canTransitionTo(IssueStatus target) {
        if (target == null || target == this) return false;
        return switch (this) {
            case ACTIVE -> target == MONITORING || target == RESOLVED;
            case MONITORING -> target == ACTIVE || target == RESOLVED;
            case RESOLVED -> false;
        };
    }
}
