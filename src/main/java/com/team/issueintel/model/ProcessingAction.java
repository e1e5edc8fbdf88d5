package com.team.issueintel.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProcessingAction {
    CREATED, LINKED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
