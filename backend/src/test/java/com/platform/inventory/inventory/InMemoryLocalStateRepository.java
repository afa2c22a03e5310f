package com.platform.inventory.inventory;

import com.platform.inventory.error.OrphanCleanupException;
import com.platform.inventory.model.InstanceStatus;
import com.platform.inventory.model.LocalInstance;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * In-memory inventory for unit tests.
 * 
 * Each transaction works on the live maps and restores a snapshot if the work throws.
 * Failures can be injected per instance for the port mapping delete and the soft delete.
 */
public class InMemoryLocalStateRepository implements LocalStateRepository {
    
    private final Map<Long, LocalInstance> instances = new LinkedHashMap<>();
    private final Map<Long, Integer> portMappings = new LinkedHashMap<>();
    private final Set<Long> deleted = new HashSet<>();
    
    private final Set<Long> failSoftDeleteFor = new HashSet<>();
    private final Set<Long> failPortMappingDeleteFor = new HashSet<>();
    private RuntimeException queryFailure;
    private int transactionCount;
    
    public LocalInstance add(long id, String name, long providerId, String status, int portMappingCount) {
        LocalInstance instance = new LocalInstance(id, name, providerId, status, Instant.now(), Instant.now());
        instances.put(id, instance);
        portMappings.put(id, portMappingCount);
        return instance;
    }
    
    public void failSoftDelete(long instanceId) {
        failSoftDeleteFor.add(instanceId);
    }
    
    public void failPortMappingDelete(long instanceId) {
        failPortMappingDeleteFor.add(instanceId);
    }
    
    public void failQueries(RuntimeException failure) {
        this.queryFailure = failure;
    }
    
    public boolean isLive(long instanceId) {
        return instances.containsKey(instanceId) && !deleted.contains(instanceId);
    }
    
    public String statusOf(long instanceId) {
        return instances.get(instanceId).status();
    }
    
    public int portMappingsOf(long instanceId) {
        return portMappings.getOrDefault(instanceId, 0);
    }
    
    public int transactionCount() {
        return transactionCount;
    }
    
    @Override
    public synchronized List<LocalInstance> findNonTerminalInstances(long providerId) {
        if (queryFailure != null) {
            throw queryFailure;
        }
        return instances.values().stream()
            .filter(i -> i.providerId() == providerId)
            .filter(i -> !deleted.contains(i.id()))
            .filter(i -> !InstanceStatus.terminalDeletionStatuses().contains(i.status()))
            .sorted(Comparator.comparingLong(LocalInstance::id))
            .toList();
    }
    
    @Override
    public synchronized void inTransaction(Consumer<InventoryTransaction> work) {
        transactionCount++;
        Map<Long, LocalInstance> instancesBefore = new LinkedHashMap<>(instances);
        Map<Long, Integer> portMappingsBefore = new LinkedHashMap<>(portMappings);
        Set<Long> deletedBefore = new HashSet<>(deleted);
        
        try {
            work.accept(new InMemoryTransaction());
        } catch (RuntimeException e) {
            instances.clear();
            instances.putAll(instancesBefore);
            portMappings.clear();
            portMappings.putAll(portMappingsBefore);
            deleted.clear();
            deleted.addAll(deletedBefore);
            throw e;
        }
    }
    
    private final class InMemoryTransaction implements InventoryTransaction {
        
        @Override
        public long countPortMappings(long instanceId) {
            return portMappings.getOrDefault(instanceId, 0);
        }
        
        @Override
        public int deletePortMappings(long instanceId) {
            if (failPortMappingDeleteFor.contains(instanceId)) {
                throw new IllegalStateException("port mapping delete failed for " + instanceId);
            }
            Integer removed = portMappings.put(instanceId, 0);
            return removed != null ? removed : 0;
        }
        
        @Override
        public void softDeleteInstance(LocalInstance instance) {
            if (failSoftDeleteFor.contains(instance.id())) {
                throw new OrphanCleanupException(instance.id(), instance.name(), "injected failure");
            }
            if (!isLive(instance.id())) {
                throw new OrphanCleanupException(instance.id(), instance.name(), "not live");
            }
            deleted.add(instance.id());
            LocalInstance current = instances.get(instance.id());
            instances.put(instance.id(), new LocalInstance(current.id(), current.name(), current.providerId(),
                InstanceStatus.DELETED, current.createdAt(), Instant.now()));
        }
    }
}
