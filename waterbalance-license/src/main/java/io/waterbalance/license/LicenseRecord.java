package io.waterbalance.license;

import io.waterbalance.license.hardware.HardwareFingerprint;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * The license held by this installation, cached locally for offline use.
 *
 * <p>Created on the first successful activation and never deleted afterwards;
 * revocation is recorded as {@link LicenseStatus#REVOKED}. Hardware bindings
 * only change through activation or an approved transfer.
 *
 * @param key the license key
 * @param status last status observed online
 * @param tier the license tier
 * @param hardwareBindings fingerprint this license is bound to
 * @param licenseeName registered licensee
 * @param licenseeEmail registered licensee email
 * @param expiryDate last day of validity (null = perpetual)
 * @param transferCount hardware transfers consumed, 0..{@link #MAX_TRANSFERS}
 * @param activatedAt when this installation was activated
 * @param lastVerifiedAt last successful online validation
 * @param offlineGraceUntil end of the offline grace window (null = none)
 * @param lastTransferAt when the last transfer was approved (null = never)
 * @param manualVerificationDate local day the manual-check counter belongs to
 * @param manualVerificationCount manual checks used on that day
 * @param lastSeenAt latest wall-clock time observed by a validation
 */
public record LicenseRecord(
    String key,
    LicenseStatus status,
    LicenseTier tier,
    HardwareFingerprint hardwareBindings,
    String licenseeName,
    String licenseeEmail,
    LocalDate expiryDate,
    int transferCount,
    Instant activatedAt,
    Instant lastVerifiedAt,
    Instant offlineGraceUntil,
    Instant lastTransferAt,
    LocalDate manualVerificationDate,
    int manualVerificationCount,
    Instant lastSeenAt
) {

    /**
     * Hardware transfers allowed over the life of a license.
     */
    public static final int MAX_TRANSFERS = 3;

    /**
     * A successful validation this close to expiry carries a renewal warning.
     */
    public static final int EXPIRY_WARNING_DAYS = 7;

    public LicenseRecord {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(tier, "tier cannot be null");
        hardwareBindings = hardwareBindings == null ? HardwareFingerprint.unbound() : hardwareBindings;
        if (key.isBlank()) {
            throw new IllegalArgumentException("key cannot be blank");
        }
        if (transferCount < 0 || transferCount > MAX_TRANSFERS) {
            throw new IllegalArgumentException(
                "transferCount must be between 0 and " + MAX_TRANSFERS + ": " + transferCount);
        }
        if (manualVerificationCount < 0) {
            throw new IllegalArgumentException("manualVerificationCount cannot be negative");
        }
    }

    /**
     * True once the last day of validity has passed.
     */
    public boolean isExpired(LocalDate today) {
        return expiryDate != null && expiryDate.isBefore(today);
    }

    /**
     * Days until expiry (negative once expired), or null for a perpetual license.
     */
    public Long daysToExpiry(LocalDate today) {
        return expiryDate == null ? null : ChronoUnit.DAYS.between(today, expiryDate);
    }

    public boolean isWithinGrace(Instant now) {
        return offlineGraceUntil != null && now.isBefore(offlineGraceUntil);
    }

    public int remainingTransfers() {
        return MAX_TRANSFERS - transferCount;
    }

    /**
     * Manual checks already used on {@code today}; a counter from an earlier day counts as zero.
     */
    public int manualVerificationsOn(LocalDate today) {
        return today.equals(manualVerificationDate) ? manualVerificationCount : 0;
    }

    /**
     * Get masked key for display (e.g., "XXXX...YYYY").
     */
    public String getMaskedKey() {
        return maskKey(key);
    }

    public static String maskKey(String key) {
        if (key == null || key.length() < 8) return "****";
        return key.substring(0, 4) + "..." + key.substring(key.length() - 4);
    }

    /**
     * Record a successful online check.
     */
    public LicenseRecord withVerification(Instant now, Instant graceUntil) {
        return new LicenseRecord(key, LicenseStatus.ACTIVE, tier, hardwareBindings, licenseeName, licenseeEmail,
            expiryDate, transferCount, activatedAt, now, graceUntil, lastTransferAt,
            manualVerificationDate, manualVerificationCount, latest(lastSeenAt, now));
    }

    /**
     * Adopt the commercial terms read from the registry. Transfer count never goes down.
     */
    public LicenseRecord withRemoteTerms(LicenseTier remoteTier, LocalDate remoteExpiry, int remoteTransferCount) {
        int transfers = Math.min(MAX_TRANSFERS, Math.max(transferCount, remoteTransferCount));
        return new LicenseRecord(key, status, remoteTier != null ? remoteTier : tier, hardwareBindings,
            licenseeName, licenseeEmail, remoteExpiry != null ? remoteExpiry : expiryDate, transfers,
            activatedAt, lastVerifiedAt, offlineGraceUntil, lastTransferAt,
            manualVerificationDate, manualVerificationCount, lastSeenAt);
    }

    /**
     * Record a status observed online (revocation or expiry).
     */
    public LicenseRecord withStatus(LicenseStatus newStatus) {
        return new LicenseRecord(key, newStatus, tier, hardwareBindings, licenseeName, licenseeEmail,
            expiryDate, transferCount, activatedAt, lastVerifiedAt, offlineGraceUntil, lastTransferAt,
            manualVerificationDate, manualVerificationCount, lastSeenAt);
    }

    /**
     * Rebind to new hardware after an approved transfer.
     */
    public LicenseRecord withTransfer(HardwareFingerprint newBindings, Instant now, Instant graceUntil) {
        if (transferCount >= MAX_TRANSFERS) {
            throw new IllegalStateException("Transfer limit reached (" + transferCount + "/" + MAX_TRANSFERS + ")");
        }
        return new LicenseRecord(key, LicenseStatus.ACTIVE, tier, newBindings, licenseeName, licenseeEmail,
            expiryDate, transferCount + 1, activatedAt, now, graceUntil, now,
            manualVerificationDate, manualVerificationCount, latest(lastSeenAt, now));
    }

    public LicenseRecord withManualVerification(LocalDate day, int count) {
        return new LicenseRecord(key, status, tier, hardwareBindings, licenseeName, licenseeEmail,
            expiryDate, transferCount, activatedAt, lastVerifiedAt, offlineGraceUntil, lastTransferAt,
            day, count, lastSeenAt);
    }

    /**
     * Advance the clock high-water mark; never moves it backwards.
     */
    public LicenseRecord withLastSeen(Instant now) {
        Instant seen = latest(lastSeenAt, now);
        if (Objects.equals(seen, lastSeenAt)) {
            return this;
        }
        return new LicenseRecord(key, status, tier, hardwareBindings, licenseeName, licenseeEmail,
            expiryDate, transferCount, activatedAt, lastVerifiedAt, offlineGraceUntil, lastTransferAt,
            manualVerificationDate, manualVerificationCount, seen);
    }

    /**
     * Latest trusted wall-clock reading, used to detect the clock being wound back.
     */
    public Instant clockHighWaterMark() {
        return latest(lastSeenAt, lastVerifiedAt);
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
