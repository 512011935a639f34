package io.infopulse.ingestion.api.dto;

import java.util.Locale;

public enum Category {
    CYBERSEC,
    AITOOLS,
    OPENSOURCE,
    INFOSEC_NEWS;

    /**
     * Lenient lookup for query parameters: case-insensitive, dashes accepted for underscores.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static Category from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Category is blank");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Category.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown category: " + value, e);
        }
    }
}
