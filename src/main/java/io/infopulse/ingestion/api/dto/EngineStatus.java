package io.infopulse.ingestion.api.dto;

/**
 * @param lastCycle null until the first cycle completes
 */
public record EngineStatus(
        boolean running,
        int enabledSources,
        int maxConcurrentFetches,
        long scheduleIntervalMs,
        long totalItems,
        CycleSummary lastCycle
) {}
