package com.phillippitts.tempokey.service.cache;

import com.phillippitts.tempokey.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

class JdbcCacheStoreTest extends CacheStoreContractTest {

    private EmbeddedDatabase db;
    private MutableClock clock;
    private JdbcCacheStore store;

    @BeforeEach
    void setUp() {
        db = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .addScript("classpath:schema.sql")
                .build();
        // Whole seconds so TIMESTAMP precision never matters for equality checks.
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z").truncatedTo(ChronoUnit.SECONDS));
        store = new JdbcCacheStore(new JdbcTemplate(db), new TransactionTemplate(new DataSourceTransactionManager(db)),
                clock);
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Override
    protected CacheStore store() {
        return store;
    }

    @Override
    protected void advance(Duration d) {
        clock.advance(d);
    }
}
