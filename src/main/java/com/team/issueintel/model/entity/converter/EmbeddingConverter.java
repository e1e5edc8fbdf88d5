package com.team.issueintel.model.entity.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class EmbeddingConverter extends JsonAttributeConverter<double[]> {

    public EmbeddingConverter() {
        super(new TypeReference<>() {});
    }

    @Override
    protected double[] empty() {
        return null;
    }
}
