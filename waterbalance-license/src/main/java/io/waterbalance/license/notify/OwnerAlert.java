package io.waterbalance.license.notify;

import io.waterbalance.license.hardware.HardwareFingerprint;

import java.time.Instant;
import java.util.Objects;

/**
 * Email to the registered owner of a license about a transfer.
 *
 * @param kind notice of a transfer in progress, or of a blocked attempt
 * @param recipientEmail the registered address (never a caller-typed one)
 * @param recipientName the registered licensee name
 * @param maskedKey license key in display form
 * @param newFingerprint fingerprint of the machine asking for the license
 * @param timestamp when the request was made
 * @param sourceIp best-effort address of the requesting machine (may be null)
 */
public record OwnerAlert(
    Kind kind,
    String recipientEmail,
    String recipientName,
    String maskedKey,
    HardwareFingerprint newFingerprint,
    Instant timestamp,
    String sourceIp
) {

    public enum Kind {
        TRANSFER_NOTICE,
        UNAUTHORIZED_ATTEMPT
    }

    public OwnerAlert {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(recipientEmail, "recipientEmail cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        recipientName = recipientName == null || recipientName.isBlank() ? "License Owner" : recipientName;
    }
}
