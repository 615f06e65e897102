package com.example.cicdbackend.domain;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class ManualTestsConverter extends JsonColumnConverter<List<ManualTestItem>> {

    public ManualTestsConverter() {
        super(new TypeReference<>() {});
    }
}
