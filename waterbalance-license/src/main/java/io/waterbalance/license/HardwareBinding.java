package io.waterbalance.license;

import io.waterbalance.license.hardware.HardwareFingerprint;
import io.waterbalance.license.hardware.HardwareFingerprinter;
import io.waterbalance.license.registry.RemoteRecord;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether this machine holds a license.
 *
 * <p>The registry binding is authoritative whenever the registry row has one.
 * The local binding only stands in for it when the registry has none, or while
 * a transfer made on this machine has not reached the registry yet: the local
 * transfer is less than {@link #REGISTRY_SYNC_WINDOW} old and the registry still
 * counts fewer transfers than this machine does. Once the registry counts the
 * transfer, or counts one made elsewhere, its binding wins.
 */
public final class HardwareBinding {

    /**
     * How long a transfer made on this machine may go unpublished.
     */
    public static final Duration REGISTRY_SYNC_WINDOW = Duration.ofHours(24);

    private HardwareBinding() {}

    /**
     * True if {@code current} may use the license during validation or a transfer request.
     *
     * @param remote the registry row
     * @param local the local record for the same key, or null
     * @param current fingerprint of this machine
     * @param now current time
     * @param threshold components that must agree
     */
    public static boolean holdsLicense(RemoteRecord remote, LicenseRecord local, HardwareFingerprint current,
                                       Instant now, int threshold) {
        boolean localMatch = local != null
            && HardwareFingerprinter.matches(current, local.hardwareBindings(), threshold);
        if (!remote.hasBinding()) {
            return localMatch;
        }
        if (HardwareFingerprinter.matches(current, remote.bindings(), threshold)) {
            return true;
        }
        return localMatch && transferAwaitingRegistry(remote, local, now);
    }

    /**
     * True if {@code current} may activate the license. Only an unbound row or a
     * row already bound to this machine qualifies; a local record never overrides
     * a foreign registry binding here.
     */
    public static boolean mayActivate(RemoteRecord remote, HardwareFingerprint current, int threshold) {
        return !remote.hasBinding() || HardwareFingerprinter.matches(current, remote.bindings(), threshold);
    }

    /**
     * The binding reported in mismatch messages: the registry's, else the local one.
     */
    public static HardwareFingerprint effectiveBinding(RemoteRecord remote, LicenseRecord local) {
        if (remote.hasBinding()) {
            return remote.bindings();
        }
        return local != null ? local.hardwareBindings() : HardwareFingerprint.unbound();
    }

    static boolean transferAwaitingRegistry(RemoteRecord remote, LicenseRecord local, Instant now) {
        return local.lastTransferAt() != null
            && local.lastTransferAt().isAfter(now.minus(REGISTRY_SYNC_WINDOW))
            && remote.transferCount() < local.transferCount();
    }
}
