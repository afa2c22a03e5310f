package com.platform.inventory.error;

/**
 * Error codes returned by the API and attached to every {@link InventoryException}.
 * 
 * Format: INV-{CATEGORY}{NUMBER}
 * - 1xx: request errors
 * - 3xx: unknown resources and conflicting jobs
 * - 4xx: database and provider failures
 * - 5xx: orphan cleanup
 * - 9xx: anything unexpected
 */
public enum ErrorCode {
    
    // ==================== Request Errors (1xx) ====================
    
    INVALID_REQUEST("INV-101", "Invalid request", Severity.RECOVERABLE),
    MISSING_REQUIRED_FIELD("INV-102", "Missing required parameter", Severity.RECOVERABLE),
    INVALID_FIELD_VALUE("INV-103", "Invalid parameter value", Severity.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    PROVIDER_NOT_FOUND("INV-301", "Provider not found", Severity.RECOVERABLE),
    JOB_NOT_FOUND("INV-302", "Reconciliation job not found", Severity.RECOVERABLE),
    RECONCILIATION_IN_PROGRESS("INV-310", "Reconciliation already running", Severity.RECOVERABLE),
    
    // ==================== Database and Provider Errors (4xx) ====================
    
    DATABASE_ERROR("INV-400", "Inventory database error", Severity.FATAL),
    PROVIDER_UNREACHABLE("INV-410", "Provider unreachable", Severity.RECOVERABLE),
    PROVIDER_AUTH_FAILED("INV-411", "Provider rejected credentials", Severity.RECOVERABLE),
    PROVIDER_UNSUPPORTED("INV-412", "Unsupported provider type", Severity.FATAL),
    
    // ==================== Cleanup Errors (5xx) ====================
    
    ORPHAN_CLEANUP_FAILED("INV-520", "Orphan cleanup failed", Severity.RECOVERABLE),
    
    // ==================== Unexpected (9xx) ====================
    
    UNEXPECTED_ERROR("INV-901", "Unexpected error occurred", Severity.FATAL);
    
    private final String code;
    private final String defaultMessage;
    private final Severity severity;
    
    ErrorCode(String code, String defaultMessage, Severity severity) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.severity = severity;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    /**
     * Fatal errors need an operator: a misconfigured provider, a broken database.
     * Recoverable ones go away on retry or with a corrected request.
     */
    public boolean isFatal() {
        return severity == Severity.FATAL;
    }
    
    private enum Severity {
        RECOVERABLE,
        FATAL
    }
}
