package io.infopulse.ingestion.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
@ConditionalOnProperty(prefix = "ingestion.events", name = "enabled", havingValue = "true")
public class KafkaConfig {

    private static final int PARTITIONS = 3;

    private final EventTopics topics;

    public KafkaConfig(EventTopics topics) {
        this.topics = topics;
    }

    @Bean
    public NewTopic intelligenceIngestedTopic() {
        return TopicBuilder.name(topics.intelligenceIngested()).partitions(PARTITIONS).build();
    }

    @Bean
    public NewTopic severityAlertTopic() {
        return TopicBuilder.name(topics.severityAlert()).partitions(1).build();
    }

    @Bean
    public NewTopic cycleCompletedTopic() {
        return TopicBuilder.name(topics.cycleCompleted()).partitions(1).build();
    }
}
