package com.forgemind.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Provides the {@link BehaviorStore} bean.
 * <p>
 * With {@code forgemind.store.type=jdbc} a pooled {@link DataSource} is built from
 * {@code forgemind.store.jdbc.*} and a {@link JdbcBehaviorStore} persists to it (PostgreSQL
 * in production). Otherwise an {@link InMemoryBehaviorStore} is used as a fallback:
 * suitable for development and testing but not durable across restarts.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "forgemind.store", name = "type", havingValue = "jdbc")
    public DataSource behaviorStoreDataSource(StoreProperties properties) {
        StoreProperties.Jdbc jdbc = properties.getJdbc();
        log.info("Configuring behavior store DataSource at {}", jdbc.getUrl());
        return DataSourceBuilder.create()
                .url(jdbc.getUrl())
                .username(jdbc.getUsername())
                .password(jdbc.getPassword())
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "forgemind.store", name = "type", havingValue = "jdbc")
    public BehaviorStore jdbcBehaviorStore(DataSource behaviorStoreDataSource, StoreProperties properties)
            throws Exception {
        log.info("Configuring JDBC behavior store");
        var store = new JdbcBehaviorStore(behaviorStoreDataSource);
        if (properties.getJdbc().isInitializeSchema()) {
            store.createTables();
        }
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(BehaviorStore.class)
    @ConditionalOnProperty(prefix = "forgemind.store", name = "type", havingValue = "memory", matchIfMissing = true)
    public BehaviorStore memoryBehaviorStore() {
        log.info("Using in-memory behavior store (state will not persist across restarts)");
        return new InMemoryBehaviorStore();
    }
}
