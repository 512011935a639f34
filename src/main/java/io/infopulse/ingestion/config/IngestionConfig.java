package io.infopulse.ingestion.config;

import io.infopulse.ingestion.api.exception.ConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

@ConfigurationProperties(prefix = "ingestion")
public record IngestionConfig(
        List<FeedSource> sources,
        ProcessingConfig processing,
        HttpConfig http,
        SeverityAnalysis severity
) {

    public IngestionConfig {
        sources = sources == null ? List.of() : List.copyOf(sources);
        processing = processing == null ? ProcessingConfig.defaults() : processing;
        http = http == null ? HttpConfig.defaults() : http;
        severity = severity == null ? SeverityAnalysis.defaults() : severity;

        validateSources(sources);
    }

    public List<FeedSource> getEnabledSources() {
        return sources.stream()
                .filter(FeedSource::enabled)
                .toList();
    }

    private static void validateSources(List<FeedSource> sources) {
        Set<String> ids = new HashSet<>();

        for (FeedSource source : sources) {
            if (source.id() == null || source.id().isBlank()) {
                throw new ConfigurationException("Feed source without id: " + source.name());
            }
            if (!ids.add(source.id())) {
                throw new ConfigurationException("Duplicate feed source id: " + source.id());
            }
            if (source.url() == null || source.url().isBlank()) {
                throw new ConfigurationException("Feed source " + source.id() + " has no url");
            }
            if (source.categories().isEmpty()) {
                throw new ConfigurationException("Feed source " + source.id() + " declares no category");
            }
        }
    }
}
