package com.sailfish.retrydispatch.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Stores a set of HTTP-style status codes as a comma-delimited column, e.g. {@code "429,502,503"}.
 */
@Converter
public class StatusCodeSetConverter implements AttributeConverter<Set<Integer>, String> {

    @Override
    public String convertToDatabaseColumn(Set<Integer> codes) {
        if (codes == null || codes.isEmpty()) {
            return null;
        }
        return codes.stream()
                .sorted()
                .map(String::valueOf)
                .collect(Collectors.joining(","));
    }

    @Override
    public Set<Integer> convertToEntityAttribute(String column) {
        Set<Integer> codes = new TreeSet<>();
        if (column == null || column.isBlank()) {
            return codes;
        }
        for (String token : column.split(",")) {
            String code = token.trim();
            if (code.isEmpty()) {
                continue;
            }
            try {
                codes.add(Integer.valueOf(code));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid status code '" + code + "' in column value: " + column, e);
            }
        }
        return codes;
    }
}
