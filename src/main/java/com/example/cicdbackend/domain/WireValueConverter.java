package com.example.cicdbackend.domain;

import jakarta.persistence.AttributeConverter;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores an enum as its lowercase wire value, for columns the pipeline writes as free text.
 * Reading accepts any case; a value outside the enum is read as null.
 */
@Slf4j
public abstract class WireValueConverter<E extends Enum<E> & WireEnum> implements AttributeConverter<E, String> {

    private final Class<E> type;

    protected WireValueConverter(Class<E> type) {
        this.type = type;
    }

    @Override
    public String convertToDatabaseColumn(E attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public E convertToEntityAttribute(String dbData) {
        if (dbData == null) return null;
        return WireEnum.lookup(type, dbData).orElseGet(() -> {
            log.warn("Ignoring unknown {} value '{}'", type.getSimpleName(), dbData);
            return null;
        });
    }
}
