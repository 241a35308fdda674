package io.waterbalance.license.audit;

/**
 * Security-relevant actions recorded in the {@link AuditLog}.
 */
public enum AuditEventType {
    ACTIVATE,
    VALIDATE_OK,
    VALIDATE_FAIL,
    TRANSFER_REQUESTED,
    TRANSFER_APPROVED,
    TRANSFER_DENIED,
    REVOKED_DETECTED
}
