package com.example.cicdbackend.domain;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.List;
import java.util.Map;

/** Scanner findings are kept as delivered: a list of free-form JSON objects. */
@Converter
public class VulnerabilitiesConverter extends JsonColumnConverter<List<Map<String, Object>>> {

    public VulnerabilitiesConverter() {
        super(new TypeReference<>() {});
    }
}
