package com.phillippitts.tempokey.service.cache;

import com.phillippitts.tempokey.domain.CacheUpdate;
import com.phillippitts.tempokey.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCacheStoreTest extends CacheStoreContractTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
    private final InMemoryCacheStore store = new InMemoryCacheStore(clock);

    @Override
    protected CacheStore store() {
        return store;
    }

    @Override
    protected void advance(Duration d) {
        clock.advance(d);
    }

    @Test
    void concurrentMergesOnOneTrackAreSerialized() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                String source = "s" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return store.merge("t1", CacheUpdate.builder().source(source).build());
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.get("t1")).isPresent();
    }
}
