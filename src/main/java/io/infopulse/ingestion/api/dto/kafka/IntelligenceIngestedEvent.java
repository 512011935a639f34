package io.infopulse.ingestion.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.infopulse.ingestion.api.dto.Category;
import io.infopulse.ingestion.api.dto.IntelligenceItem;
import io.infopulse.ingestion.api.dto.Severity;

import java.time.Instant;

public record IntelligenceIngestedEvent(
        @JsonProperty("itemId") String itemId,
        @JsonProperty("sourceId") String sourceId,
        @JsonProperty("category") Category category,
        @JsonProperty("title") String title,
        @JsonProperty("url") String url,
        @JsonProperty("summary") String summary,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("publishedAt") Instant publishedAt,
        @JsonProperty("ingestedAt") Instant ingestedAt
) {
    public static IntelligenceIngestedEvent create(IntelligenceItem item) {
        return new IntelligenceIngestedEvent(
                item.id(),
                item.sourceId(),
                item.category(),
                item.title(),
                item.url(),
                item.summary(),
                item.severity(),
                item.published(),
                Instant.now()
        );
    }
}
