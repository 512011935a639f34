package io.infopulse.ingestion.api.dto;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of one ingestion cycle.
 *
 * @param failures source id to failure message, for sources that failed this cycle
 */
public record CycleSummary(
        String cycleId,
        Trigger trigger,
        Instant startedAt,
        long durationMs,
        int sourcesAttempted,
        int sourcesFailed,
        int itemsFetched,
        int itemsInserted,
        int itemsEvicted,
        Map<String, String> failures
) {
    public enum Trigger {
        SCHEDULED,
        MANUAL
    }

    public CycleSummary {
        failures = failures == null ? Map.of() : Map.copyOf(failures);
    }
}
