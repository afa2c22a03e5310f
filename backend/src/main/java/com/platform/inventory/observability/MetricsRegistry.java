package com.platform.inventory.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry for application metrics.
 * Wraps Micrometer so callers record reconciliation events by name.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        incrementCounterBy(name, 1, tags);
    }
    
    private void incrementCounterBy(String name, double amount, String... tags) {
        String key = name + ":" + String.join(",", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment(amount);
    }
    
    /**
     * Record one finished reconciliation pass.
     */
    public void recordReconciliationPass(String provider, String outcome, long durationMs) {
        incrementCounter("inventory.reconciliation.passes", "provider", provider, "outcome", outcome);
        
        Timer timer = timers.computeIfAbsent("reconciliation.duration." + provider, k ->
            Timer.builder("inventory.reconciliation.duration")
                .tag("provider", provider)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        timer.record(Duration.ofMillis(durationMs));
        
        log.debug("Recorded reconciliation pass for {}: {} in {}ms", provider, outcome, durationMs);
    }
    
    public void recordOrphansDetected(String provider, int count) {
        if (count > 0) {
            incrementCounterBy("inventory.reconciliation.orphans.detected", count, "provider", provider);
        }
    }
    
    public void recordOrphanCleaned(String provider, int portMappings) {
        incrementCounter("inventory.reconciliation.orphans.cleaned", "provider", provider);
        if (portMappings > 0) {
            incrementCounterBy("inventory.reconciliation.portmappings.cleaned", portMappings, "provider", provider);
        }
    }
    
    public void recordOrphanCleanupFailure(String provider) {
        incrementCounter("inventory.reconciliation.orphans.failed", "provider", provider);
    }
    
    /**
     * Port mapping removal failed but the instance cleanup went ahead.
     */
    public void recordPortMappingCleanupWarning(String provider) {
        incrementCounter("inventory.reconciliation.portmappings.warnings", "provider", provider);
    }
    
    public void recordDuplicateRemoteNames(String provider, int count) {
        incrementCounterBy("inventory.reconciliation.remote.duplicates", count, "provider", provider);
    }
    
    public void recordProviderCallFailure(String provider, String operation) {
        incrementCounter("inventory.provider.call.failure", "provider", provider, "operation", operation);
    }
}
