package com.platform.inventory.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Configuration for REST clients used to talk to providers.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate providerRestTemplate(RestTemplateBuilder builder, ReconciliationProperties properties) {
        ReconciliationProperties.ProviderClient client = properties.getProvider();
        return builder
            .setConnectTimeout(Duration.ofMillis(client.getConnectTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(client.getReadTimeoutMs()))
            .build();
    }
}
