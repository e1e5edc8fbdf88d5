package com.team.issueintel.model.entity.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

@Converter
public class StringMapConverter extends JsonAttributeConverter<Map<String, String>> {

    public StringMapConverter() {
        super(new TypeReference<>() {});
    }

    @Override
    protected Map<String, String> empty() {
        return new LinkedHashMap<>();
    }
}
