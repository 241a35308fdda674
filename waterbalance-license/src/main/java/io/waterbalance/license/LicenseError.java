package io.waterbalance.license;

/**
 * Why a license operation failed.
 */
public enum LicenseError {

    /**
     * Registry unreachable. Never means "invalid"; resolved by grace logic.
     */
    NETWORK_ERROR(false, false),

    NOT_FOUND(true, false),

    REVOKED(true, false),

    EXPIRED(true, false),

    /**
     * Offline and the grace window has elapsed.
     */
    OFFLINE_EXPIRED(false, false),

    /**
     * This machine does not match the binding; recoverable through a transfer.
     */
    HARDWARE_MISMATCH(false, true),

    TRANSFER_LIMIT_EXCEEDED(false, true),

    EMAIL_VERIFICATION_FAILED(false, true),

    RATE_LIMITED(false, true),

    /**
     * Registry row exists but has not been enabled yet.
     */
    INACTIVE(false, true),

    NOT_ACTIVATED(false, true),

    /**
     * System clock is behind the last time this license was seen.
     */
    CLOCK_TAMPERED(false, true),

    STORAGE_ERROR(false, false),

    INVALID_INPUT(false, true);

    private final boolean terminal;
    private final boolean userFacing;

    LicenseError(boolean terminal, boolean userFacing) {
        this.terminal = terminal;
        this.userFacing = userFacing;
    }

    /**
     * Terminal errors block usage regardless of any grace window.
     */
    public boolean isTerminal() {
        return terminal;
    }

    /**
     * User-facing errors need an action from the user rather than a retry.
     */
    public boolean isUserFacing() {
        return userFacing;
    }
}
