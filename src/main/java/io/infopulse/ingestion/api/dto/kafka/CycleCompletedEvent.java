package io.infopulse.ingestion.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.infopulse.ingestion.api.dto.CycleSummary;

import java.time.Instant;

public record CycleCompletedEvent(
        @JsonProperty("cycleId") String cycleId,
        @JsonProperty("trigger") CycleSummary.Trigger trigger,
        @JsonProperty("sourcesAttempted") int sourcesAttempted,
        @JsonProperty("sourcesFailed") int sourcesFailed,
        @JsonProperty("itemsFetched") int itemsFetched,
        @JsonProperty("itemsInserted") int itemsInserted,
        @JsonProperty("itemsEvicted") int itemsEvicted,
        @JsonProperty("processingDurationMs") long processingDurationMs,
        @JsonProperty("completedAt") Instant completedAt
) {
    public static CycleCompletedEvent create(CycleSummary summary) {
        return new CycleCompletedEvent(
                summary.cycleId(),
                summary.trigger(),
                summary.sourcesAttempted(),
                summary.sourcesFailed(),
                summary.itemsFetched(),
                summary.itemsInserted(),
                summary.itemsEvicted(),
                summary.durationMs(),
                Instant.now()
        );
    }
}
