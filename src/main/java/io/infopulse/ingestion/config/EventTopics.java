package io.infopulse.ingestion.config;

import io.infopulse.ingestion.api.dto.Severity;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Set;

@ConfigurationProperties(prefix = "ingestion.events")
public record EventTopics(
        boolean enabled,
        String intelligenceIngested,
        String severityAlert,
        String cycleCompleted,
        Set<Severity> alertSeverities
) {
    public EventTopics {
        if (intelligenceIngested == null) intelligenceIngested = "intelligence-ingested";
        if (severityAlert == null) severityAlert = "severity-alert";
        if (cycleCompleted == null) cycleCompleted = "ingestion-cycle-completed";
        alertSeverities = alertSeverities == null
                ? Set.of(Severity.CRITICAL, Severity.HIGH)
                : Set.copyOf(alertSeverities);
    }

    public static EventTopics disabled() {
        return new EventTopics(false, null, null, null, null);
    }

    public boolean isAlertWorthy(Severity severity) {
        return severity != null && alertSeverities.contains(severity);
    }
}
