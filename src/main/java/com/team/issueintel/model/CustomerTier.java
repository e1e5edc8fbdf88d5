package com.team.issueintel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CustomerTier {
    STANDARD, PREMIUM, ENTERPRISE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CustomerTier from(String value) {
        if (value == null || value.isBlank()) return STANDARD;
        try {
            return CustomerTier.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return STANDARD;
        }
    }
}
