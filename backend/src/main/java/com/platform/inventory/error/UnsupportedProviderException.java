package com.platform.inventory.error;

/**
 * No client implementation exists for the provider's type.
 */
public class UnsupportedProviderException extends InventoryException {
    
    private final String providerType;
    
    public UnsupportedProviderException(String providerType) {
        super(ErrorCode.PROVIDER_UNSUPPORTED, "No provider client for type: " + providerType);
        this.providerType = providerType;
    }
    
    public String getProviderType() {
        return providerType;
    }
}
