package io.waterbalance.license.audit;

import java.time.Instant;
import java.util.Objects;

/**
 * One immutable entry of the audit trail.
 *
 * @param eventType what happened
 * @param timestamp when it happened
 * @param licenseKey key the event concerns (null if none is known yet)
 * @param sourceIp source address for transfer events (may be null)
 * @param details free-form reason or context
 */
public record AuditEvent(
    AuditEventType eventType,
    Instant timestamp,
    String licenseKey,
    String sourceIp,
    String details
) {

    public AuditEvent {
        Objects.requireNonNull(eventType, "eventType cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        details = details == null ? "" : details;
    }

    public static AuditEvent of(AuditEventType type, Instant timestamp, String licenseKey, String details) {
        return new AuditEvent(type, timestamp, licenseKey, null, details);
    }
}
