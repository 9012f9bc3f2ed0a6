package com.phillippitts.tempokey.config;

import com.phillippitts.tempokey.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for work that outlives the request thread.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.bulk.*}).
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Pool for bulk preparation (per-track preview resolution) and for proxying batch streams to
     * HTTP clients.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and queue
     * are full the submitting thread runs the task, which throttles bulk submitters.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext from the submitting thread so bulk work
     * logs under the originating request ID.
     *
     * @return executor bean named {@code bulkExecutor}
     */
    @Bean(name = "bulkExecutor")
    public ThreadPoolTaskExecutor bulkExecutor() {
        ThreadPoolProperties.BulkPoolProperties bulkProps = threadPoolProperties.getBulk();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(bulkProps.getCorePoolSize());
        executor.setMaxPoolSize(bulkProps.getMaxPoolSize());
        executor.setQueueCapacity(bulkProps.getQueueCapacity());
        executor.setThreadNamePrefix(bulkProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(bulkProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
