package com.example.cicdbackend.domain;

import java.util.Optional;

/**
 * Enum whose constants travel over the API as lowercase wire values
 * ("pending", "in_progress"). Most are persisted by constant name;
 * free-text columns use a {@link WireValueConverter}.
 */
public interface WireEnum {

    String getValue();

    /**
     * Resolve a query-string value against the constants of {@code type}, ignoring case.
     * Returns empty for anything that is not one of the enumerated values.
     */
    static <E extends Enum<E> & WireEnum> Optional<E> lookup(Class<E> type, String raw) {
        if (raw == null) return Optional.empty();
        String candidate = raw.trim();
        for (E constant : type.getEnumConstants()) {
            if (constant.getValue().equalsIgnoreCase(candidate)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }

    static <E extends Enum<E> & WireEnum> String describe(Class<E> type) {
        StringBuilder values = new StringBuilder();
        for (E constant : type.getEnumConstants()) {
            if (values.length() > 0) values.append(", ");
            values.append(constant.getValue());
        }
        return values.toString();
    }
}
