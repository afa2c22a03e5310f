package com.platform.inventory.error;

/**
 * Provider could not be reached or refused our credentials.
 * Fatal to a reconciliation pass: nothing is cleaned up.
 */
public class ConnectivityException extends InventoryException {
    
    private final String providerName;
    
    public ConnectivityException(ErrorCode errorCode, String providerName, String message) {
        super(errorCode, message);
        this.providerName = providerName;
    }
    
    public ConnectivityException(ErrorCode errorCode, String providerName, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.providerName = providerName;
    }
    
    public static ConnectivityException unreachable(String providerName, String message, Throwable cause) {
        return new ConnectivityException(
            ErrorCode.PROVIDER_UNREACHABLE,
            providerName,
            message,
            cause
        );
    }
    
    public static ConnectivityException unauthorized(String providerName, String message) {
        return new ConnectivityException(
            ErrorCode.PROVIDER_AUTH_FAILED,
            providerName,
            message
        );
    }
    
    public String getProviderName() {
        return providerName;
    }
}
