package io.waterbalance.license;

import java.time.Instant;

/**
 * License summary for display in the shell.
 *
 * @param statusText human readable status line
 * @param daysToExpiry days until expiry (null = perpetual or no license)
 * @param transferCount transfers used
 * @param maxTransfers transfers allowed
 * @param tier license tier (null if no license)
 * @param state current validator state
 * @param maskedKey license key in display form (null if no license)
 * @param lastVerifiedAt last successful online check
 * @param offlineGraceUntil end of the offline grace window
 */
public record LicenseStatusView(
    String statusText,
    Long daysToExpiry,
    int transferCount,
    int maxTransfers,
    LicenseTier tier,
    LicenseState state,
    String maskedKey,
    Instant lastVerifiedAt,
    Instant offlineGraceUntil
) {

    static LicenseStatusView unlicensed(LicenseState state) {
        return new LicenseStatusView("Not activated", null, 0, LicenseRecord.MAX_TRANSFERS,
            null, state, null, null, null);
    }

    public boolean isLicensed() {
        return maskedKey != null;
    }
}
