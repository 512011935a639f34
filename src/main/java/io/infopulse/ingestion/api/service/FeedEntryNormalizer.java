package io.infopulse.ingestion.api.service;

import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import io.infopulse.ingestion.api.dto.IntelligenceItem;
import io.infopulse.ingestion.api.dto.Severity;
import io.infopulse.ingestion.api.util.Fingerprints;
import io.infopulse.ingestion.config.FeedSource;
import io.infopulse.ingestion.config.IngestionConfig;
import io.infopulse.ingestion.config.SeverityAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * Maps parsed feed entries to {@link IntelligenceItem}s. Stateless.
 */
@Component
public class FeedEntryNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(FeedEntryNormalizer.class);

    static final String UNTITLED = "Untitled";
    static final String TRUNCATION_MARKER = "...";

    private final int summaryMaxLength;
    private final SeverityAnalysis severityAnalysis;

    public FeedEntryNormalizer(IngestionConfig config) {
        this.summaryMaxLength = config.processing().summaryMaxLength();
        this.severityAnalysis = config.severity();
    }

    public List<IntelligenceItem> normalize(SyndFeed feed, FeedSource source, Instant fetchedAt) {
        List<SyndEntry> entries = feed.getEntries();
        if (entries == null || entries.isEmpty()) {
            logger.warn("Feed {} has no entries", source.id());
            return List.of();
        }

        List<IntelligenceItem> items = new ArrayList<>(entries.size());
        for (int position = 0; position < entries.size(); position++) {
            normalize(entries.get(position), position, source, fetchedAt).ifPresent(items::add);
        }
        return items;
    }

    /**
     * @return empty when the entry has neither title nor link
     */
    public Optional<IntelligenceItem> normalize(SyndEntry entry, int position, FeedSource source, Instant fetchedAt) {
        if (entry == null) {
            return Optional.empty();
        }

        String rawTitle = entry.getTitle();
        String link = entry.getLink() != null ? entry.getLink().trim() : "";

        if (isBlank(rawTitle) && link.isEmpty()) {
            logger.debug("Skipping entry {} of {}: no title and no link", position, source.id());
            return Optional.empty();
        }

        String title = isBlank(rawTitle) ? UNTITLED : cleanText(rawTitle);
        String rawSummary = rawSummary(entry);
        String summary = rawSummary.isEmpty() ? title : truncate(cleanText(rawSummary));

        Severity severity = severityAnalysis.classify(rawTitle, rawSummary).orElse(null);

        return Optional.of(new IntelligenceItem(
                itemId(entry, position, source, fetchedAt),
                source.id(),
                source.primaryCategory(),
                title,
                link,
                summary,
                publishedAt(entry, fetchedAt),
                fetchedAt,
                Fingerprints.contentHash(rawTitle, link, rawSummary),
                severity
        ));
    }

    private String itemId(SyndEntry entry, int position, FeedSource source, Instant fetchedAt) {
        String nativeId = entry.getUri();
        return isBlank(nativeId)
                ? Fingerprints.fallbackItemId(source.id(), fetchedAt, position)
                : Fingerprints.itemId(source.id(), nativeId);
    }

    // Description first, then the first non-empty content block.
    private static String rawSummary(SyndEntry entry) {
        SyndContent description = entry.getDescription();
        if (description != null && !isBlank(description.getValue())) {
            return description.getValue();
        }

        if (entry.getContents() != null) {
            for (SyndContent content : entry.getContents()) {
                if (content != null && !isBlank(content.getValue())) {
                    return content.getValue();
                }
            }
        }
        return "";
    }

    private static Instant publishedAt(SyndEntry entry, Instant fetchedAt) {
        Date published = entry.getPublishedDate();
        if (published != null) {
            return published.toInstant();
        }
        Date updated = entry.getUpdatedDate();
        if (updated != null) {
            return updated.toInstant();
        }
        return fetchedAt;
    }

    String truncate(String text) {
        if (text.length() <= summaryMaxLength) {
            return text;
        }
        return text.substring(0, summaryMaxLength) + TRUNCATION_MARKER;
    }

    static String cleanText(String text) {
        if (text == null) return "";

        return text
                .replaceAll("(?i)<br\\s*/?>", "\n")   // Keep line breaks
                .replaceAll("<[^>]+>", " ")            // Remove HTML tags
                .replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&amp;", "&")
                .replaceAll("[ \\t\\x0B\\f\\r]+", " ") // Normalize whitespace, keep newlines
                .replaceAll(" ?\n ?", "\n")
                .trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
