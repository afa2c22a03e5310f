package com.platform.inventory.persistence.repository;

import com.platform.inventory.persistence.entity.InstanceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Spring Data JPA repository for locally tracked instances.
 */
@Repository
public interface InstanceJpaRepository extends JpaRepository<InstanceEntity, Long> {
    
    /**
     * Find live instances of a provider, skipping the given statuses.
     * Soft-deleted rows are never returned.
     */
    @Query("SELECT i FROM InstanceEntity i " +
           "WHERE i.providerId = :providerId " +
           "AND i.deletedAt IS NULL " +
           "AND i.status NOT IN :excludedStatuses " +
           "ORDER BY i.id ASC")
    List<InstanceEntity> findLiveByProviderExcludingStatuses(
        @Param("providerId") Long providerId,
        @Param("excludedStatuses") Collection<String> excludedStatuses
    );
    
    /**
     * All live instances of a provider (for quota accounting).
     */
    List<InstanceEntity> findByProviderIdAndDeletedAtIsNull(Long providerId);
    
    /**
     * Soft-delete a live instance.
     * Returns 0 when the row is missing or was already deleted.
     */
    @Modifying
    @Transactional
    @Query("UPDATE InstanceEntity i SET i.status = :status, i.deletedAt = :now, i.updatedAt = :now " +
           "WHERE i.id = :id AND i.deletedAt IS NULL")
    int softDelete(@Param("id") Long id, @Param("status") String status, @Param("now") Instant now);
}
