package io.waterbalance.license;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of the license validator.
 *
 * <p>Transitions are checked by {@link #canTransitionTo(LicenseState)}; the
 * validator treats any other move as a programming error.
 */
public enum LicenseState {

    /**
     * Nothing validated yet in this process.
     */
    UNLICENSED,

    ACTIVATING,

    ACTIVE,

    /**
     * Last online check failed for network reasons; running on the grace window.
     */
    OFFLINE_GRACE,

    /**
     * Last attempt failed for a non-terminal reason (not found, mismatch, offline expired).
     */
    REJECTED,

    REVOKED,

    EXPIRED;

    /**
     * True if the validator may move from this state to {@code target}.
     *
     * <p>{@link #ACTIVATING} only ends in {@link #ACTIVE} or {@link #REJECTED};
     * an activation refused for a revoked or expired key is a rejection of that
     * key, not a verdict on the stored license. Every other state is settled and
     * any validation may move it to any other settled state or start an
     * activation:
     * <ul>
     *   <li>{@code REVOKED} or {@code EXPIRED} back to {@code ACTIVE} once the
     *       registry shows the license reinstated or renewed</li>
     *   <li>{@code REVOKED} or {@code EXPIRED} to {@code OFFLINE_GRACE} when the
     *       registry verdict could not be written to disk and the next check is
     *       offline</li>
     *   <li>{@code ACTIVE} or {@code OFFLINE_GRACE} to {@code REJECTED} on a
     *       hardware mismatch or when offline use is refused</li>
     * </ul>
     * A move to the current state is not a transition. Nothing returns to
     * {@link #UNLICENSED}.
     */
    public boolean canTransitionTo(LicenseState target) {
        return target != this && allowedTargets().contains(target);
    }

    private Set<LicenseState> allowedTargets() {
        return switch (this) {
            case ACTIVATING -> EnumSet.of(ACTIVE, REJECTED);
            case UNLICENSED, ACTIVE, OFFLINE_GRACE, REJECTED, REVOKED, EXPIRED ->
                EnumSet.of(ACTIVATING, ACTIVE, OFFLINE_GRACE, REJECTED, REVOKED, EXPIRED);
        };
    }

    /**
     * True if the license may be used in this state.
     */
    public boolean isUsable() {
        return this == ACTIVE || this == OFFLINE_GRACE;
    }
}
