package io.infopulse.ingestion.config;

import io.infopulse.ingestion.api.dto.Category;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Locale;

/**
 * Static description of one external feed. Immutable after configuration load.
 *
 * @param enabled    true when omitted
 * @param updateFreq suggested refresh interval in minutes, informational only
 */
public record FeedSource(
        String id,
        String name,
        String url,
        List<Category> categories,
        String fetchMethod,
        @DefaultValue("true") boolean enabled,
        int updateFreq
) {
    public static final String DEFAULT_FETCH_METHOD = "rss";

    public FeedSource {
        categories = categories == null ? List.of() : List.copyOf(categories);
        fetchMethod = fetchMethod == null || fetchMethod.isBlank()
                ? DEFAULT_FETCH_METHOD
                : fetchMethod.trim().toLowerCase(Locale.ROOT);
        name = name == null || name.isBlank() ? id : name;
    }

    /**
     * First declared category; records are indexed under this one only.
     */
    public Category primaryCategory() {
        return categories.get(0);
    }
}
