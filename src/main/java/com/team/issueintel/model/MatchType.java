package com.team.issueintel.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchType {
    SEMANTIC("semantic"),
    KEYWORD("keyword"),
    CUSTOMER("customer"),
    BRAND_LOCATION("brand-location");

    private final String value;

    MatchType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
