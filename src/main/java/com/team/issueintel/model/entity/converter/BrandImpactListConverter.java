package com.team.issueintel.model.entity.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.team.issueintel.model.BrandImpact;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class BrandImpactListConverter extends JsonAttributeConverter<List<BrandImpact>> {

    public BrandImpactListConverter() {
        super(new TypeReference<>() {});
    }

    @Override
    protected List<BrandImpact> empty() {
        return new ArrayList<>();
    }
}
