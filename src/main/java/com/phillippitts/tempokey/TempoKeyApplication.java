package com.phillippitts.tempokey;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        com.phillippitts.tempokey.config.properties.CacheProperties.class,
        com.phillippitts.tempokey.config.properties.PreviewProperties.class,
        com.phillippitts.tempokey.config.properties.DetectionProperties.class,
        com.phillippitts.tempokey.config.properties.AdminProperties.class
})
@EnableScheduling
public class TempoKeyApplication {

    public static void main(String[] args) {
        SpringApplication.run(TempoKeyApplication.class, args);
    }

}
