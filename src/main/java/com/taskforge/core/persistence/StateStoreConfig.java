package com.taskforge.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;

/**
 * Provides the {@link StateStore} used for registry snapshots.
 * <p>
 * With a {@link DataSource} (PostgreSQL profile) snapshots go to the database;
 * otherwise an in-memory store is used and nothing survives a restart.
 */
@Configuration
public class StateStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StateStoreConfig.class);

    @Bean
    @Primary
    @ConditionalOnBean(DataSource.class)
    public StateStore jdbcStateStore(DataSource dataSource) throws Exception {
        log.info("Configuring JDBC state store");
        var store = new JdbcStateStore(dataSource);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(StateStore.class)
    public StateStore inMemoryStateStore() {
        log.info("No DataSource available; using in-memory state store (state will not persist across restarts)");
        return new InMemoryStateStore();
    }

    @Bean
    public StateSnapshots stateSnapshots(StateStore stateStore) {
        return new StateSnapshots(stateStore);
    }
}
