package io.infopulse.ingestion.api.dto;

import io.infopulse.ingestion.config.FeedSource;

import java.time.Instant;
import java.util.List;

public record SourcesInfo(
        List<FeedSource> sources,
        int totalSources,
        int enabledSources,
        Instant lastUpdated
) {}
