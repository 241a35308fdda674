package io.waterbalance.license.transfer;

import io.waterbalance.license.LicenseError;
import io.waterbalance.license.LicenseRecord;

/**
 * Result of a transfer request.
 *
 * @param approved whether the license is bound to this machine afterwards
 * @param error failure kind (null if approved)
 * @param message user-facing message
 * @param record the license record after the request (may be null)
 * @param sourceIp address recorded for an approved transfer
 * @param transferred true if a transfer was consumed; false if none was needed
 */
public record TransferResult(
    boolean approved,
    LicenseError error,
    String message,
    LicenseRecord record,
    String sourceIp,
    boolean transferred
) {

    public static TransferResult approved(LicenseRecord record, String sourceIp) {
        return new TransferResult(true, null, String.format(
            "License transferred to this machine (%d of %d transfers used)",
            record.transferCount(), LicenseRecord.MAX_TRANSFERS), record, sourceIp, true);
    }

    /**
     * The license already matches this machine; no transfer consumed.
     */
    public static TransferResult notRequired(LicenseRecord record) {
        return new TransferResult(true, null,
            "This machine already holds the license; no transfer needed", record, null, false);
    }

    public static TransferResult denied(LicenseError error, String message, LicenseRecord record) {
        return new TransferResult(false, error, message, record, null, false);
    }
}
