package com.platform.inventory.provider;

import com.platform.inventory.error.QueryException;
import com.platform.inventory.model.Provider;
import com.platform.inventory.persistence.EntityMappers;
import com.platform.inventory.persistence.repository.ProviderJpaRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Read access to registered providers.
 * Delegates to the JPA repository.
 */
@Component
public class ProviderRegistry {
    
    private final ProviderJpaRepository jpaRepository;
    private final EntityMappers entityMappers;
    
    public ProviderRegistry(ProviderJpaRepository jpaRepository, EntityMappers entityMappers) {
        this.jpaRepository = jpaRepository;
        this.entityMappers = entityMappers;
    }
    
    /**
     * Find a provider that is currently active.
     */
    public Optional<Provider> findActive(long providerId) {
        try {
            return jpaRepository.findByIdAndStatus(providerId, Provider.STATUS_ACTIVE)
                .map(entityMappers::toDomain);
        } catch (DataAccessException e) {
            throw new QueryException("Failed to load provider " + providerId, e);
        }
    }
    
    /**
     * All active providers, ordered by id.
     */
    public List<Provider> listActive() {
        try {
            return jpaRepository.findByStatusOrderByIdAsc(Provider.STATUS_ACTIVE).stream()
                .map(entityMappers::toDomain)
                .toList();
        } catch (DataAccessException e) {
            throw new QueryException("Failed to list active providers", e);
        }
    }
}
