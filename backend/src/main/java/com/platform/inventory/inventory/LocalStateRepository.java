package com.platform.inventory.inventory;

import com.platform.inventory.model.LocalInstance;

import java.util.List;
import java.util.function.Consumer;

/**
 * Persisted view of the instance inventory, as seen by reconciliation.
 */
public interface LocalStateRepository {
    
    /**
     * Every live instance of the provider whose status is not in the terminal-deletion set.
     *
     * @throws com.platform.inventory.error.QueryException if the inventory cannot be read
     */
    List<LocalInstance> findNonTerminalInstances(long providerId);
    
    /**
     * Run {@code work} in a new transaction of its own, independent of any caller transaction.
     * An exception thrown by {@code work} rolls back that transaction only and is rethrown.
     */
    void inTransaction(Consumer<InventoryTransaction> work);
}
