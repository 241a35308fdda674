package io.waterbalance.license.hardware;

/**
 * Source of the current machine's {@link HardwareFingerprint}.
 *
 * <p>Matching is fuzzy: a network adapter can be reconfigured or replaced
 * on a legitimate machine while the CPU and board stay put, so only
 * {@link #DEFAULT_THRESHOLD} of the {@value HardwareFingerprint#COMPONENT_COUNT}
 * components have to agree.
 *
 * @see SystemHardwareFingerprinter
 */
@FunctionalInterface
public interface HardwareFingerprinter {

    int DEFAULT_THRESHOLD = 2;

    /**
     * Probe this machine. Never fails; unreadable components fall back to a
     * hostname-derived pseudo identifier.
     */
    HardwareFingerprint probe();

    /**
     * True iff at least {@code threshold} components are equal.
     *
     * @param local fingerprint of this machine
     * @param remote fingerprint on record
     * @param threshold number of components that must agree (1..3)
     */
    static boolean matches(HardwareFingerprint local, HardwareFingerprint remote, int threshold) {
        if (threshold < 1 || threshold > HardwareFingerprint.COMPONENT_COUNT) {
            throw new IllegalArgumentException("threshold must be between 1 and "
                + HardwareFingerprint.COMPONENT_COUNT + ": " + threshold);
        }
        if (local == null || remote == null) {
            return false;
        }
        return local.matchCount(remote) >= threshold;
    }

    /**
     * Fuzzy match with the {@link #DEFAULT_THRESHOLD}.
     */
    static boolean matches(HardwareFingerprint local, HardwareFingerprint remote) {
        return matches(local, remote, DEFAULT_THRESHOLD);
    }
}
