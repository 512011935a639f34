package io.infopulse.ingestion.api.dto;

import java.time.Instant;

/**
 * Canonical record produced from one feed entry. Never updated once created.
 *
 * @param hash     content fingerprint, the dedup key
 * @param severity null unless the item references a vulnerability
 */
public record IntelligenceItem(
        String id,
        String sourceId,
        Category category,
        String title,
        String url,
        String summary,
        Instant published,
        Instant retrieved,
        String hash,
        Severity severity
) {}
