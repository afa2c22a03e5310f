package com.platform.inventory.inventory;

import com.platform.inventory.error.OrphanCleanupException;
import com.platform.inventory.error.QueryException;
import com.platform.inventory.model.InstanceStatus;
import com.platform.inventory.model.LocalInstance;
import com.platform.inventory.persistence.EntityMappers;
import com.platform.inventory.persistence.repository.InstanceJpaRepository;
import com.platform.inventory.persistence.repository.PortMappingJpaRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

/**
 * JPA-backed inventory used by reconciliation.
 * 
 * Each call to {@link #inTransaction} opens a REQUIRES_NEW transaction, so one orphan's
 * rollback never touches work already committed for another.
 * Port mappings are deleted through JDBC: a failing statement there does not mark the
 * JPA transaction rollback-only, which keeps that step best-effort.
 */
@Slf4j
@Component
public class JpaLocalStateRepository implements LocalStateRepository {
    
    private static final String DELETE_PORT_MAPPINGS_SQL = "DELETE FROM port_mappings WHERE instance_id = ?";
    
    private final InstanceJpaRepository instanceRepository;
    private final PortMappingJpaRepository portMappingRepository;
    private final JdbcTemplate jdbcTemplate;
    private final EntityMappers entityMappers;
    private final TransactionTemplate transactionTemplate;
    
    public JpaLocalStateRepository(
            InstanceJpaRepository instanceRepository,
            PortMappingJpaRepository portMappingRepository,
            JdbcTemplate jdbcTemplate,
            EntityMappers entityMappers,
            PlatformTransactionManager transactionManager) {
        this.instanceRepository = instanceRepository;
        this.portMappingRepository = portMappingRepository;
        this.jdbcTemplate = jdbcTemplate;
        this.entityMappers = entityMappers;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.transactionTemplate.setName("inventory-orphan-cleanup");
    }
    
    @Override
    public List<LocalInstance> findNonTerminalInstances(long providerId) {
        try {
            List<LocalInstance> instances = instanceRepository
                .findLiveByProviderExcludingStatuses(providerId, InstanceStatus.terminalDeletionStatuses())
                .stream()
                .map(entityMappers::toDomain)
                .toList();
            log.debug("Loaded {} non-terminal instances for provider {}", instances.size(), providerId);
            return instances;
        } catch (DataAccessException e) {
            throw new QueryException("Failed to query instances for provider " + providerId, e);
        }
    }
    
    @Override
    public void inTransaction(Consumer<InventoryTransaction> work) {
        transactionTemplate.executeWithoutResult(status -> work.accept(new JpaInventoryTransaction()));
    }
    
    private final class JpaInventoryTransaction implements InventoryTransaction {
        
        @Override
        public long countPortMappings(long instanceId) {
            return portMappingRepository.countByInstanceId(instanceId);
        }
        
        @Override
        public int deletePortMappings(long instanceId) {
            return jdbcTemplate.update(DELETE_PORT_MAPPINGS_SQL, instanceId);
        }
        
        @Override
        public void softDeleteInstance(LocalInstance instance) {
            int updated = instanceRepository.softDelete(instance.id(), InstanceStatus.DELETED, Instant.now());
            if (updated == 0) {
                throw new OrphanCleanupException(instance.id(), instance.name(),
                    "Instance record " + instance.id() + " is no longer live");
            }
        }
    }
}
