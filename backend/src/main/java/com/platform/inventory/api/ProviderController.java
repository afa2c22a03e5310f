package com.platform.inventory.api;

import com.platform.inventory.model.Provider;
import com.platform.inventory.provider.ProviderRegistry;
import com.platform.inventory.quota.QuotaUsage;
import com.platform.inventory.quota.QuotaUsageService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only view of providers and their quota usage.
 */
@RestController
@RequestMapping("/api/providers")
public class ProviderController {
    
    private final ProviderRegistry providerRegistry;
    private final QuotaUsageService quotaUsageService;
    
    public ProviderController(ProviderRegistry providerRegistry, QuotaUsageService quotaUsageService) {
        this.providerRegistry = providerRegistry;
        this.quotaUsageService = quotaUsageService;
    }
    
    @GetMapping
    public List<Provider> listProviders() {
        return providerRegistry.listActive().stream()
            .map(Provider::redacted)
            .toList();
    }
    
    @GetMapping("/{providerId}/quota")
    public QuotaUsage getQuota(@PathVariable long providerId) {
        return quotaUsageService.usage(providerId);
    }
}
