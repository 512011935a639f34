package io.infopulse.ingestion.api.service;

import io.infopulse.ingestion.api.dto.IntelligenceItem;
import io.infopulse.ingestion.api.exception.FeedException;
import io.infopulse.ingestion.config.FeedSource;

import java.util.List;

/**
 * Retrieves one source and maps its entries to canonical items. Implementations hold no
 * per-call state and are invoked from several worker threads at once.
 */
public interface FeedFetcher {

    /**
     * Tag matched against {@link FeedSource#fetchMethod()}.
     */
    String fetchMethod();

    /**
     * Single attempt; no retries.
     *
     * @throws FeedException on transport, HTTP status or parse failure
     */
    List<IntelligenceItem> fetch(FeedSource source) throws FeedException;
}
