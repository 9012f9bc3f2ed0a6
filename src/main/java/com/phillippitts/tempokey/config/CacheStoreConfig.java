package com.phillippitts.tempokey.config;

import com.phillippitts.tempokey.service.cache.CacheStore;
import com.phillippitts.tempokey.service.cache.InMemoryCacheStore;
import com.phillippitts.tempokey.service.cache.JdbcCacheStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Selects the {@link CacheStore} implementation from {@code tempo.cache.store}.
 *
 * <p>The JDBC variant needs the datasource auto-configuration, which the default profile
 * excludes; the {@code jdbc} profile re-enables it.
 */
@Configuration
public class CacheStoreConfig {
    private static final Logger LOG = LogManager.getLogger(CacheStoreConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "tempo.cache.store", havingValue = "memory", matchIfMissing = true)
    public CacheStore inMemoryCacheStore(Clock clock) {
        LOG.info("Using in-memory cache store (contents are lost on restart)");
        return new InMemoryCacheStore(clock);
    }

    @Bean
    @ConditionalOnProperty(name = "tempo.cache.store", havingValue = "jdbc")
    public CacheStore jdbcCacheStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager txManager, Clock clock) {
        LOG.info("Using JDBC cache store");
        return new JdbcCacheStore(jdbcTemplate, new TransactionTemplate(txManager), clock);
    }
}
