package com.platform.inventory.persistence;

import com.platform.inventory.model.LocalInstance;
import com.platform.inventory.model.Provider;
import com.platform.inventory.persistence.entity.InstanceEntity;
import com.platform.inventory.persistence.entity.ProviderEntity;
import org.springframework.stereotype.Component;

/**
 * Mappers from JPA entities to domain records.
 * The engine never writes whole entities back, so there is no reverse direction.
 */
@Component
public class EntityMappers {
    
    // ==================== Instance ====================
    
    public LocalInstance toDomain(InstanceEntity entity) {
        return new LocalInstance(
            entity.getId(),
            entity.getName(),
            entity.getProviderId(),
            entity.getStatus(),
            entity.getCreatedAt(),
            entity.getUpdatedAt()
        );
    }
    
    // ==================== Provider ====================
    
    public Provider toDomain(ProviderEntity entity) {
        return new Provider(
            entity.getId(),
            entity.getName(),
            entity.getType(),
            entity.getEndpoint(),
            entity.getApiToken(),
            entity.getStatus()
        );
    }
}
