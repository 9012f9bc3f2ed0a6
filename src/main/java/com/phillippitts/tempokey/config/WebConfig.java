package com.phillippitts.tempokey.config;

import com.phillippitts.tempokey.config.properties.DetectionProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Streams bulk results on the bulk executor (so they inherit the request's MDC) and lets them stay
 * open as long as the upstream stream timeout allows.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final ThreadPoolTaskExecutor bulkExecutor;
    private final DetectionProperties detectionProps;

    public WebConfig(@Qualifier("bulkExecutor") ThreadPoolTaskExecutor bulkExecutor,
                     DetectionProperties detectionProps) {
        this.bulkExecutor = bulkExecutor;
        this.detectionProps = detectionProps;
    }

    @Override
    public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        configurer.setTaskExecutor(bulkExecutor);
        configurer.setDefaultTimeout(detectionProps.getStreamTimeout().toMillis());
    }
}
