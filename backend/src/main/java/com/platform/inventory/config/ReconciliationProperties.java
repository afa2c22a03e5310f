package com.platform.inventory.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the reconciliation engine.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "inventory.reconciliation")
@Validated
public class ReconciliationProperties {
    
    /**
     * Number of finished passes kept in memory for the history endpoint.
     */
    @Min(1)
    private int historySize = 500;
    
    @Valid
    private Scheduler scheduler = new Scheduler();
    
    @Valid
    private ProviderClient provider = new ProviderClient();
    
    @Data
    public static class Scheduler {
        /**
         * Whether all active providers are reconciled periodically.
         */
        private boolean enabled = true;
        
        @Positive
        private long intervalMs = 300_000;
        
        @Min(0)
        private long initialDelayMs = 60_000;
    }
    
    @Data
    public static class ProviderClient {
        @Positive
        private int connectTimeoutMs = 5000;
        
        @Positive
        private int readTimeoutMs = 30000;
    }
}
