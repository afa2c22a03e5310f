package com.platform.inventory.error;

/**
 * Local inventory could not be read. Fatal to a reconciliation pass.
 */
public class QueryException extends InventoryException {
    
    public QueryException(String message, Throwable cause) {
        super(ErrorCode.DATABASE_ERROR, message, cause);
    }
}
