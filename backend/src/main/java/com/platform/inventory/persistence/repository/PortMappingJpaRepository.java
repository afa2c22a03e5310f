package com.platform.inventory.persistence.repository;

import com.platform.inventory.persistence.entity.PortMappingEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for port mappings.
 */
@Repository
public interface PortMappingJpaRepository extends JpaRepository<PortMappingEntity, Long> {
    
    long countByInstanceId(Long instanceId);
    
    List<PortMappingEntity> findByInstanceId(Long instanceId);
}
