package io.infopulse.ingestion.api.service;

import io.infopulse.ingestion.api.dto.CycleSummary;
import io.infopulse.ingestion.api.dto.IntelligenceItem;
import io.infopulse.ingestion.api.dto.kafka.CycleCompletedEvent;
import io.infopulse.ingestion.api.dto.kafka.IntelligenceIngestedEvent;
import io.infopulse.ingestion.api.dto.kafka.SeverityAlertEvent;
import io.infopulse.ingestion.config.EventTopics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes ingestion notifications to Kafka. Publishing is best effort: every failure is
 * logged and swallowed so that it never affects ingestion.
 */
@Service
public class EventPublisherService {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisherService.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final EventTopics topics;

    public EventPublisherService(KafkaTemplate<String, Object> kafkaTemplate, EventTopics topics) {
        this.kafkaTemplate = kafkaTemplate;
        this.topics = topics;
    }

    /**
     * Announces newly stored items and raises alerts for the severe ones.
     */
    public void publishNewItems(List<IntelligenceItem> items) {
        if (!topics.enabled()) {
            return;
        }

        for (IntelligenceItem item : items) {
            publishIntelligenceIngested(item);

            if (topics.isAlertWorthy(item.severity())) {
                publishSeverityAlert(item);
            }
        }
    }

    public void publishIntelligenceIngested(IntelligenceItem item) {
        if (!topics.enabled()) {
            return;
        }

        try {
            IntelligenceIngestedEvent event = IntelligenceIngestedEvent.create(item);

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topics.intelligenceIngested(), item.id(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.debug("Sent intelligence ingested event: {} to partition: {}",
                            item.id(), result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to send intelligence ingested event: {}", item.id(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing intelligence ingested event for item: {}", item.id(), e);
        }
    }

    public void publishSeverityAlert(IntelligenceItem item) {
        if (!topics.enabled() || !topics.isAlertWorthy(item.severity())) {
            return;
        }

        try {
            SeverityAlertEvent event = SeverityAlertEvent.create(item);

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topics.severityAlert(), event.alertId(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.warn("ALERT SENT: {} severity item {} ({})",
                            item.severity(), item.id(), event.alertId());
                } else {
                    logger.error("Failed to send severity alert: {}", event.alertId(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing severity alert for item: {}", item.id(), e);
        }
    }

    public void publishCycleCompleted(CycleSummary summary) {
        if (!topics.enabled()) {
            return;
        }

        try {
            CycleCompletedEvent event = CycleCompletedEvent.create(summary);

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topics.cycleCompleted(), summary.cycleId(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Sent cycle completed event: {} ({} new items)",
                            summary.cycleId(), summary.itemsInserted());
                } else {
                    logger.error("Failed to send cycle completed event: {}", summary.cycleId(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing cycle completed event for cycle: {}", summary.cycleId(), e);
        }
    }
}
