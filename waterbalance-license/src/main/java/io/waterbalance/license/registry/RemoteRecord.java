package io.waterbalance.license.registry;

import io.waterbalance.license.LicenseRecord;
import io.waterbalance.license.LicenseStatus;
import io.waterbalance.license.LicenseTier;
import io.waterbalance.license.hardware.HardwareFingerprint;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One license row as read from the registry.
 *
 * <p>The registry is eventually consistent and hand-edited, so every column
 * except the key may be missing; parsing is lenient.
 *
 * @param key the license key
 * @param status registry status (blank reads as pending)
 * @param tier license tier (unknown reads as standard)
 * @param expiryDate last day of validity (null = perpetual or unparseable)
 * @param bindings hardware binding (unbound before first activation)
 * @param licenseeName registered licensee name
 * @param licenseeEmail registered licensee email
 * @param transferCount transfers recorded by the registry
 * @param notes free-form vendor notes
 */
public record RemoteRecord(
    String key,
    LicenseStatus status,
    LicenseTier tier,
    LocalDate expiryDate,
    HardwareFingerprint bindings,
    String licenseeName,
    String licenseeEmail,
    int transferCount,
    String notes
) {

    public RemoteRecord {
        Objects.requireNonNull(key, "key cannot be null");
        status = status == null ? LicenseStatus.PENDING : status;
        tier = tier == null ? LicenseTier.STANDARD : tier;
        bindings = bindings == null ? HardwareFingerprint.unbound() : bindings;
        licenseeName = licenseeName == null ? "" : licenseeName.trim();
        licenseeEmail = licenseeEmail == null ? "" : licenseeEmail.trim();
        transferCount = Math.max(0, Math.min(LicenseRecord.MAX_TRANSFERS, transferCount));
        notes = notes == null ? "" : notes;
    }

    public boolean hasBinding() {
        return bindings.isBound();
    }

    /**
     * True if the registry marks the row expired or its expiry date has passed.
     */
    public boolean isExpired(LocalDate today) {
        return status == LicenseStatus.EXPIRED || (expiryDate != null && expiryDate.isBefore(today));
    }

    public boolean hasRegisteredEmail() {
        return !licenseeEmail.isEmpty();
    }
}
