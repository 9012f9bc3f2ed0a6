package com.phillippitts.tempokey.config;

import com.phillippitts.tempokey.service.catalog.CatalogClient;
import com.phillippitts.tempokey.service.catalog.UnconfiguredCatalogClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CatalogConfig {

    @Bean
    @ConditionalOnMissingBean(CatalogClient.class)
    public CatalogClient catalogClient() {
        return new UnconfiguredCatalogClient();
    }
}
