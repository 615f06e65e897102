package com.example.cicdbackend.service;

import com.example.cicdbackend.config.BackendProperties;
import com.example.cicdbackend.domain.WireEnum;
import com.example.cicdbackend.exception.InvalidFilterException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Validates list parameters before they reach a query:
 * limits are capped at the configured maximum, enum filters must name a known value.
 */
@Component
@RequiredArgsConstructor
public class QueryLimits {

    private final BackendProperties properties;

    public int cap(int requested) {
        if (requested < 0) {
            throw InvalidFilterException.negativeLimit(requested);
        }
        return Math.min(requested, properties.getQuery().getMaxLimit());
    }

    /** Null or blank means "no filter". */
    public <E extends Enum<E> & WireEnum> E parseFilter(Class<E> type, String parameter, String raw) {
        if (raw == null || raw.isBlank()) return null;
        return WireEnum.lookup(type, raw)
                .orElseThrow(() -> InvalidFilterException.unknownValue(parameter, raw, WireEnum.describe(type)));
    }
}
