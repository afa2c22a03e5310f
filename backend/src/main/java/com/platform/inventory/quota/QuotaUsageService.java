package com.platform.inventory.quota;

import com.platform.inventory.error.QueryException;
import com.platform.inventory.error.ResourceNotFoundException;
import com.platform.inventory.model.QuotaBucket;
import com.platform.inventory.persistence.entity.InstanceEntity;
import com.platform.inventory.persistence.repository.InstanceJpaRepository;
import com.platform.inventory.provider.ProviderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Computes quota usage of a provider from the status of its live instances.
 */
@Slf4j
@Service
public class QuotaUsageService {
    
    private final InstanceJpaRepository instanceRepository;
    private final ProviderRegistry providerRegistry;
    
    public QuotaUsageService(InstanceJpaRepository instanceRepository, ProviderRegistry providerRegistry) {
        this.instanceRepository = instanceRepository;
        this.providerRegistry = providerRegistry;
    }
    
    public QuotaUsage usage(long providerId) {
        if (providerRegistry.findActive(providerId).isEmpty()) {
            throw ResourceNotFoundException.provider(providerId);
        }
        
        List<InstanceEntity> instances;
        try {
            instances = instanceRepository.findByProviderIdAndDeletedAtIsNull(providerId);
        } catch (DataAccessException e) {
            throw new QueryException("Failed to load instances for provider " + providerId, e);
        }
        
        Map<QuotaBucket, Long> counts = new EnumMap<>(QuotaBucket.class);
        for (InstanceEntity instance : instances) {
            counts.merge(QuotaBucket.of(instance.getStatus()), 1L, Long::sum);
        }
        
        long unknown = counts.getOrDefault(QuotaBucket.UNKNOWN, 0L);
        if (unknown > 0) {
            log.warn("Provider {} has {} instances with an unrecognized status", providerId, unknown);
        }
        
        return new QuotaUsage(
            providerId,
            counts.getOrDefault(QuotaBucket.STABLE, 0L),
            counts.getOrDefault(QuotaBucket.TRANSITIONAL, 0L),
            counts.getOrDefault(QuotaBucket.TERMINAL, 0L),
            unknown
        );
    }
}
