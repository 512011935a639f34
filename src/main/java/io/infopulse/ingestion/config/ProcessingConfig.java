package io.infopulse.ingestion.config;

import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

public record ProcessingConfig(
        Duration scheduleInterval,
        Duration initialDelay,
        int maxConcurrentFetches,
        Duration retention,
        int summaryMaxLength,
        @DefaultValue("true") boolean enableScheduling,
        Duration shutdownTimeout
) {
    public static final int DEFAULT_MAX_CONCURRENT_FETCHES = 5;
    public static final int DEFAULT_SUMMARY_MAX_LENGTH = 500;

    public ProcessingConfig {
        if (scheduleInterval == null || scheduleInterval.isZero() || scheduleInterval.isNegative()) {
            scheduleInterval = Duration.ofMinutes(5);
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            initialDelay = Duration.ZERO;
        }
        if (maxConcurrentFetches <= 0) {
            maxConcurrentFetches = DEFAULT_MAX_CONCURRENT_FETCHES;
        }
        if (retention == null || retention.isZero() || retention.isNegative()) {
            retention = Duration.ofDays(30);
        }
        if (summaryMaxLength <= 0) {
            summaryMaxLength = DEFAULT_SUMMARY_MAX_LENGTH;
        }
        if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
            shutdownTimeout = Duration.ofSeconds(60);
        }
    }

    public static ProcessingConfig defaults() {
        return new ProcessingConfig(null, null, 0, null, 0, true, null);
    }

    public long getScheduleIntervalMs() {
        return scheduleInterval.toMillis();
    }

    public long getInitialDelayMs() {
        return initialDelay.toMillis();
    }
}
