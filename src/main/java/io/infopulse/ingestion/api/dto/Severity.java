package io.infopulse.ingestion.api.dto;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Declared strongest first; classification takes the first keyword that matches.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    private final Pattern keyword =
            Pattern.compile("\\b" + name().toLowerCase(Locale.ROOT) + "\\b");

    public Pattern keyword() {
        return keyword;
    }
}
