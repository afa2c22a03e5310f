package com.platform.inventory.error;

/**
 * Base of all inventory sync exceptions. The error code decides the HTTP status
 * and whether the failure is fatal.
 */
public abstract class InventoryException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected InventoryException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected InventoryException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
