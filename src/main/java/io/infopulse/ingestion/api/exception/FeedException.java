package io.infopulse.ingestion.api.exception;

/**
 * Failure to fetch or parse one source. Scoped to that source and that cycle; the next
 * cycle tries again.
 */
public class FeedException extends Exception {
    private final ErrorCategory category;

    public FeedException(String message, ErrorCategory category) {
        super(message);
        this.category = category;
    }

    public FeedException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isParseError() {
        return category == ErrorCategory.PARSE_ERROR;
    }
}
