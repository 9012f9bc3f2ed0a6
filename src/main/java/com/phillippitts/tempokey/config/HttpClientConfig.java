package com.phillippitts.tempokey.config;

import com.phillippitts.tempokey.config.properties.DetectionProperties;
import com.phillippitts.tempokey.config.properties.PreviewProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * {@link RestClient} instances for the outbound integrations. Each gets its own timeout:
 * storefront lookups are short and per attempt, single analyses wait longer, and the batch
 * stream stays open for the whole read-back.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestClient previewRestClient(PreviewProperties props) {
        return RestClient.builder()
                .requestFactory(requestFactory(props.getTimeout()))
                .defaultHeader(HttpHeaders.USER_AGENT, props.getUserAgent())
                .build();
    }

    @Bean
    public RestClient detectionRestClient(DetectionProperties props) {
        return detectionClient(props, props.getTimeout());
    }

    @Bean
    public RestClient detectionStreamRestClient(DetectionProperties props) {
        return detectionClient(props, props.getStreamTimeout());
    }

    private static RestClient detectionClient(DetectionProperties props, Duration timeout) {
        RestClient.Builder builder = RestClient.builder().requestFactory(requestFactory(timeout));
        if (props.isConfigured()) {
            builder.baseUrl(props.getBaseUrl());
        }
        return builder.build();
    }

    private static JdkClientHttpRequestFactory requestFactory(Duration timeout) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(client);
        factory.setReadTimeout(timeout);
        return factory;
    }
}
