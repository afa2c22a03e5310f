package com.platform.inventory.provider;

import com.platform.inventory.error.ConnectivityException;
import com.platform.inventory.model.Provider;
import com.platform.inventory.model.RemoteInstance;
import com.platform.inventory.observability.MetricsRegistry;
import com.platform.inventory.reconciliation.CancellationToken;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Supplier;

/**
 * Lists remote instances through the provider's client.
 * Calls go through one circuit breaker per provider, named "provider-{id}".
 */
@Slf4j
@Component
public class ProviderRemoteStateLister implements RemoteStateLister {
    
    private final ProviderClientFactory clientFactory;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final MetricsRegistry metricsRegistry;
    
    public ProviderRemoteStateLister(
            ProviderClientFactory clientFactory,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MetricsRegistry metricsRegistry) {
        this.clientFactory = clientFactory;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.metricsRegistry = metricsRegistry;
    }
    
    @Override
    public void checkConnection(Provider provider) {
        ProviderClient client = clientFactory.create(provider);
        call(provider, "checkConnection", () -> {
            client.checkConnection();
            return null;
        });
    }
    
    @Override
    public List<RemoteInstance> listInstances(Provider provider, CancellationToken cancellationToken) {
        cancellationToken.throwIfCancelled();
        ProviderClient client = clientFactory.create(provider);
        List<RemoteInstance> instances = call(provider, "listInstances", client::listInstances);
        log.debug("Provider {} reported {} instances", provider.name(), instances.size());
        return instances;
    }
    
    private <T> T call(Provider provider, String operation, Supplier<T> supplier) {
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker("provider-" + provider.id());
        try {
            return circuitBreaker.executeSupplier(supplier);
        } catch (CallNotPermittedException e) {
            metricsRegistry.recordProviderCallFailure(provider.name(), operation);
            throw ConnectivityException.unreachable(provider.name(),
                "Circuit breaker open for provider " + provider.name(), e);
        } catch (ConnectivityException e) {
            metricsRegistry.recordProviderCallFailure(provider.name(), operation);
            throw e;
        } catch (RuntimeException e) {
            metricsRegistry.recordProviderCallFailure(provider.name(), operation);
            throw ConnectivityException.unreachable(provider.name(),
                String.format("Provider %s %s failed: %s", provider.name(), operation, e.getMessage()), e);
        }
    }
}
