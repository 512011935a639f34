package io.infopulse.ingestion.config;

import io.infopulse.ingestion.api.store.InMemoryIntelligenceStore;
import io.infopulse.ingestion.api.store.IntelligenceStore;
import io.infopulse.ingestion.api.store.JdbcIntelligenceStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

@Configuration
public class StoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "ingestion.store", name = "type", havingValue = "jdbc", matchIfMissing = true)
    public IntelligenceStore jdbcIntelligenceStore(NamedParameterJdbcTemplate jdbc,
                                                   PlatformTransactionManager transactionManager) {
        return new JdbcIntelligenceStore(jdbc, transactionManager);
    }

    @Bean
    @ConditionalOnProperty(prefix = "ingestion.store", name = "type", havingValue = "memory")
    public IntelligenceStore inMemoryIntelligenceStore() {
        return new InMemoryIntelligenceStore();
    }
}
