package com.calypso.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Provides the build and published-site stores.
 * <p>
 * With {@code spring.datasource.url} set (the {@code postgres} profile), JDBC stores are
 * created and their tables ensured on startup. Otherwise in-memory stores are used, which
 * lose all state on restart.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "spring.datasource.url")
    public BuildOutputStore jdbcBuildOutputStore(DataSource dataSource, ObjectMapper objectMapper,
                                                 Clock clock) throws Exception {
        log.info("Configuring JDBC build store (PostgreSQL)");
        var store = new JdbcBuildOutputStore(dataSource, objectMapper, clock);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnProperty(name = "spring.datasource.url")
    public PublishedSiteStore jdbcPublishedSiteStore(DataSource dataSource) throws Exception {
        var store = new JdbcPublishedSiteStore(dataSource);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(BuildOutputStore.class)
    public BuildOutputStore inMemoryBuildOutputStore(Clock clock) {
        log.info("No datasource configured; using in-memory build store (state will not persist across restarts)");
        return new InMemoryBuildOutputStore(clock);
    }

    @Bean
    @ConditionalOnMissingBean(PublishedSiteStore.class)
    public PublishedSiteStore inMemoryPublishedSiteStore() {
        return new InMemoryPublishedSiteStore();
    }
}
