package com.platform.inventory.persistence.repository;

import com.platform.inventory.persistence.entity.ProviderEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for providers.
 */
@Repository
public interface ProviderJpaRepository extends JpaRepository<ProviderEntity, Long> {
    
    Optional<ProviderEntity> findByIdAndStatus(Long id, String status);
    
    List<ProviderEntity> findByStatusOrderByIdAsc(String status);
}
