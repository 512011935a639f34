package io.infopulse.ingestion.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.infopulse.ingestion.api.dto.Category;
import io.infopulse.ingestion.api.dto.IntelligenceItem;
import io.infopulse.ingestion.api.dto.Severity;

import java.time.Instant;
import java.util.UUID;

public record SeverityAlertEvent(
        @JsonProperty("alertId") String alertId,
        @JsonProperty("itemId") String itemId,
        @JsonProperty("title") String title,
        @JsonProperty("url") String url,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("category") Category category,
        @JsonProperty("sourceId") String sourceId,
        @JsonProperty("detectedAt") Instant detectedAt
) {
    public static SeverityAlertEvent create(IntelligenceItem item) {
        return new SeverityAlertEvent(
                "ALERT-" + UUID.randomUUID().toString().substring(0, 8),
                item.id(),
                item.title(),
                item.url(),
                item.severity(),
                item.category(),
                item.sourceId(),
                Instant.now()
        );
    }
}
