package com.team.issueintel.model.entity.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.LinkedHashSet;
import java.util.Set;

@Converter
public class StringSetConverter extends JsonAttributeConverter<Set<String>> {

    public StringSetConverter() {
        super(new TypeReference<>() {});
    }

    @Override
    protected Set<String> empty() {
        return new LinkedHashSet<>();
    }
}
