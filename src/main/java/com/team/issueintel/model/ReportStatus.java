package com.team.issueintel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Incident report lifecycle: DRAFT → GENERATED → REVIEWED → PUBLISHED, forward only.
 */
public enum ReportStatus {
    DRAFT, GENERATED, REVIEWED, PUBLISHED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ReportStatus from(String value) {
        return ReportStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean canAdvanceTo(ReportStatus target) {
        return target != null && target.ordinal() > this.ordinal();
    }
}
