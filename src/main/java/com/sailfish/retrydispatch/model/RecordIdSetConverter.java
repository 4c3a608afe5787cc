package com.sailfish.retrydispatch.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Stores an ordered set of record ids as a single comma-delimited column.
 * An empty set is stored as {@code NULL} so that "no retry ids" can be queried with {@code IS NULL}.
 */
@Converter
public class RecordIdSetConverter implements AttributeConverter<Set<String>, String> {

    static final String DELIMITER = ",";

    @Override
    public String convertToDatabaseColumn(Set<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return null;
        }
        return String.join(DELIMITER, ids);
    }

    @Override
    public Set<String> convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) {
            return new LinkedHashSet<>();
        }
        Set<String> ids = new LinkedHashSet<>();
        for (String token : column.split(DELIMITER)) {
            String id = token.trim();
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        return ids;
    }
}
