package io.waterbalance.license.audit;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Filter for {@link AuditLog#query(AuditQuery)}. Null or empty fields match everything.
 *
 * @param types event types to include (empty = all)
 * @param licenseKey only events for this key
 * @param from inclusive lower bound on the timestamp
 * @param to exclusive upper bound on the timestamp
 */
public record AuditQuery(Set<AuditEventType> types, String licenseKey, Instant from, Instant to) {

    public AuditQuery {
        types = types == null || types.isEmpty() ? Set.of() : Set.copyOf(types);
    }

    public static AuditQuery all() {
        return new AuditQuery(Set.of(), null, null, null);
    }

    public static AuditQuery ofTypes(AuditEventType first, AuditEventType... rest) {
        return new AuditQuery(EnumSet.of(first, rest), null, null, null);
    }

    public AuditQuery forKey(String key) {
        return new AuditQuery(types, key, from, to);
    }

    public AuditQuery between(Instant from, Instant to) {
        return new AuditQuery(types, licenseKey, from, to);
    }

    public boolean matches(AuditEvent event) {
        if (!types.isEmpty() && !types.contains(event.eventType())) {
            return false;
        }
        if (licenseKey != null && !licenseKey.equals(event.licenseKey())) {
            return false;
        }
        if (from != null && event.timestamp().isBefore(from)) {
            return false;
        }
        return to == null || event.timestamp().isBefore(to);
    }
}
