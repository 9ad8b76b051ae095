package com.example.doimetadata.infrastructure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Infrastructure Spring configuration.
 * Enables the DOI settings and exposes the clock used for the publication year fallback.
 */
@Configuration
@EnableConfigurationProperties(DoiProperties.class)
public class DoiConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
