package io.waterbalance.license;

import java.util.Objects;

/**
 * Result of a license validation or activation.
 *
 * @param allowed whether the application may be used
 * @param state validator state after the operation
 * @param error failure kind (null on success)
 * @param message informational or remediation message
 * @param warning optional warning (offline grace, upcoming expiry)
 * @param record the license record after the operation (may be null)
 * @param mode the entry point that produced this result
 */
public record ValidationResult(
    boolean allowed,
    LicenseState state,
    LicenseError error,
    String message,
    String warning,
    LicenseRecord record,
    ValidationMode mode
) {

    public ValidationResult {
        Objects.requireNonNull(state, "state cannot be null");
        Objects.requireNonNull(mode, "mode cannot be null");
    }

    /**
     * Validation succeeded online.
     */
    public static ValidationResult active(LicenseRecord record, ValidationMode mode, String message) {
        return new ValidationResult(true, LicenseState.ACTIVE, null, message, null, record, mode);
    }

    /**
     * Validation succeeded online, with a warning such as an upcoming expiry.
     */
    public static ValidationResult activeWithWarning(LicenseRecord record, ValidationMode mode, String warning) {
        return new ValidationResult(true, LicenseState.ACTIVE, null, null, warning, record, mode);
    }

    /**
     * Registry unreachable, running on the offline grace window.
     */
    public static ValidationResult offlineGrace(LicenseRecord record, ValidationMode mode, String warning) {
        return new ValidationResult(true, LicenseState.OFFLINE_GRACE, null, null, warning, record, mode);
    }

    /**
     * Operation failed.
     */
    public static ValidationResult failure(LicenseState state, LicenseError error, String message,
                                           LicenseRecord record, ValidationMode mode) {
        Objects.requireNonNull(error, "error cannot be null");
        return new ValidationResult(false, state, error, message, null, record, mode);
    }

    /**
     * Manual check refused by the daily limit. The application keeps running on
     * the last known good validation, if there is one.
     */
    public static ValidationResult rateLimited(LicenseState state, LicenseRecord lastKnownGood, String message) {
        boolean usable = lastKnownGood != null && lastKnownGood.status() == LicenseStatus.ACTIVE;
        return new ValidationResult(usable, state, LicenseError.RATE_LIMITED, message, null,
            lastKnownGood, ValidationMode.MANUAL);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean hasWarning() {
        return warning != null && !warning.isBlank();
    }

    /**
     * True if the shell must block entry to the application. Only startup
     * failures block; background and manual failures surface as a passive warning.
     */
    public boolean requiresBlocking() {
        return !allowed && mode == ValidationMode.STARTUP;
    }
}
