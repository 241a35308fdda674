package io.waterbalance.license;

import java.time.Instant;

/**
 * Manual validations used today.
 *
 * @param used checks used since local midnight
 * @param limit checks allowed per local day
 * @param resetsAt next local midnight
 */
public record ManualVerificationQuota(int used, int limit, Instant resetsAt) {

    public int remaining() {
        return Math.max(0, limit - used);
    }

    public boolean isExhausted() {
        return used >= limit;
    }
}
