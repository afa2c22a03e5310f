package com.platform.inventory.error;

/**
 * Exception for resource not found errors.
 */
public class ResourceNotFoundException extends InventoryException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, 
            String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public static ResourceNotFoundException provider(long providerId) {
        return new ResourceNotFoundException(ErrorCode.PROVIDER_NOT_FOUND, "Active provider", String.valueOf(providerId));
    }
    
    public static ResourceNotFoundException job(String jobId) {
        return new ResourceNotFoundException(ErrorCode.JOB_NOT_FOUND, "Reconciliation job", jobId);
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
