package io.infopulse.ingestion.config;

import io.infopulse.ingestion.api.dto.Severity;
import io.infopulse.ingestion.api.exception.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Coarse severity tagging for security-relevant items. An item is only tagged when its
 * text carries a vulnerability identifier; the tag then comes from the strongest
 * severity keyword present, or {@code defaultSeverity} when there is none.
 */
public record SeverityAnalysis(
        String vulnerabilityPattern,
        Severity defaultSeverity
) {
    public static final String DEFAULT_VULNERABILITY_PATTERN = "CVE-\\d{4}-\\d{4,}";

    // keyed by source text; records cannot carry the compiled form as a field
    private static final Map<String, Pattern> COMPILED = new ConcurrentHashMap<>();

    public SeverityAnalysis {
        if (vulnerabilityPattern == null || vulnerabilityPattern.isBlank()) {
            vulnerabilityPattern = DEFAULT_VULNERABILITY_PATTERN;
        }
        try {
            compile(vulnerabilityPattern);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid vulnerability pattern: " + vulnerabilityPattern, e);
        }
        if (defaultSeverity == null) {
            defaultSeverity = Severity.MEDIUM;
        }
    }

    public static SeverityAnalysis defaults() {
        return new SeverityAnalysis(null, null);
    }

    public Optional<Severity> classify(String title, String summary) {
        String text = nullToEmpty(title) + " " + nullToEmpty(summary);

        if (!vulnerabilityRegex().matcher(text).find()) {
            return Optional.empty();
        }

        String lowerText = text.toLowerCase(Locale.ROOT);
        return Arrays.stream(Severity.values())
                .filter(severity -> severity.keyword().matcher(lowerText).find())
                .findFirst()
                .or(() -> Optional.of(defaultSeverity));
    }

    public Pattern vulnerabilityRegex() {
        return compile(vulnerabilityPattern);
    }

    private static Pattern compile(String pattern) {
        return COMPILED.computeIfAbsent(pattern, p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
