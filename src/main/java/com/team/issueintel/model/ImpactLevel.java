package com.team.issueintel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Locale;

/**
 * Severity of an impact, ordered from LOW to CRITICAL.
 */
public enum ImpactLevel {
    LOW, MEDIUM, HIGH, CRITICAL;

    private static final double CRITICAL_PERCENT = 50.0;
    private static final double HIGH_PERCENT = 20.0;
    private static final double MEDIUM_PERCENT = 5.0;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ImpactLevel from(String value) {
        if (value == null || value.isBlank()) return LOW;
        return ImpactLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Level for a share of affected members, given as a percentage in [0, 100].
     */
    public static ImpactLevel fromPercentage(double percentage) {
        if (percentage >= CRITICAL_PERCENT) return CRITICAL;
        if (percentage >= HIGH_PERCENT) return HIGH;
        if (percentage >= MEDIUM_PERCENT) return MEDIUM;
        return LOW;
    }

    public static ImpactLevel highest(Collection<ImpactLevel> levels) {
        ImpactLevel result = LOW;
        for (ImpactLevel level : levels) {
            if (level != null && level.compareTo(result) > 0) {
                result = level;
            }
        }
        return result;
    }
}
