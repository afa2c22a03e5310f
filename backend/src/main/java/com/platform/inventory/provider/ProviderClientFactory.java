package com.platform.inventory.provider;

import com.platform.inventory.error.UnsupportedProviderException;
import com.platform.inventory.model.Provider;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Creates the client matching a provider's type.
 */
@Component
public class ProviderClientFactory {
    
    private final RestTemplate providerRestTemplate;
    
    public ProviderClientFactory(RestTemplate providerRestTemplate) {
        this.providerRestTemplate = providerRestTemplate;
    }
    
    public ProviderClient create(Provider provider) {
        String type = provider.type() != null ? provider.type() : RestProviderClient.TYPE;
        return switch (type) {
            case RestProviderClient.TYPE -> new RestProviderClient(provider, providerRestTemplate);
            default -> throw new UnsupportedProviderException(type);
        };
    }
}
