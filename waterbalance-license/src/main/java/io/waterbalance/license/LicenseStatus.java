package io.waterbalance.license;

import java.util.Locale;

/**
 * Lifecycle status of a license, as recorded by the registry.
 */
public enum LicenseStatus {

    /**
     * Issued but not yet enabled; cannot be activated.
     */
    PENDING,

    ACTIVE,

    /**
     * Withdrawn by the vendor. Terminal regardless of any offline grace.
     */
    REVOKED,

    EXPIRED;

    /**
     * Parse a registry status column. Blank or unknown values read as {@link #PENDING}.
     */
    public static LicenseStatus fromRegistry(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "active", "valid" -> ACTIVE;
            case "revoked", "suspended", "banned" -> REVOKED;
            case "expired" -> EXPIRED;
            default -> PENDING;
        };
    }

    /**
     * Lowercase wire form, as written to the registry.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
