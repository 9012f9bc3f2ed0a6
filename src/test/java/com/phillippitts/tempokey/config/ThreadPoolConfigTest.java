package com.phillippitts.tempokey.config;

import com.phillippitts.tempokey.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void shouldCreateExecutorWithDefaultSizing() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).bulkExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(4);
        assertThat(executor.getMaxPoolSize()).isEqualTo(8);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("bulk-pool-");
    }

    @Test
    void shouldHonourConfiguredSizing() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getBulk().setCorePoolSize(2);
        properties.getBulk().setMaxPoolSize(3);
        properties.getBulk().setThreadNamePrefix("batch-");

        executor = new ThreadPoolConfig(properties).bulkExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(2);
        assertThat(executor.getMaxPoolSize()).isEqualTo(3);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("batch-");
    }

    @Test
    void shouldPropagateRequestContextToWorker() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).bulkExecutor();
        ThreadContext.put("requestId", "req-bulk-1");

        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> threadName = new AtomicReference<>();
        executor.execute(() -> {
            seen.set(ThreadContext.get("requestId"));
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("req-bulk-1");
        assertThat(threadName.get()).startsWith("bulk-pool-");
    }

    @Test
    void shouldNotLeakContextBetweenTasks() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getBulk().setCorePoolSize(1);
        properties.getBulk().setMaxPoolSize(1);
        executor = new ThreadPoolConfig(properties).bulkExecutor();

        ThreadContext.put("requestId", "first");
        CountDownLatch first = new CountDownLatch(1);
        executor.execute(first::countDown);
        assertThat(first.await(5, TimeUnit.SECONDS)).isTrue();

        ThreadContext.clearAll();
        CountDownLatch second = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>("unset");
        executor.execute(() -> {
            seen.set(ThreadContext.get("requestId"));
            second.countDown();
        });

        assertThat(second.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isNull();
    }
}
