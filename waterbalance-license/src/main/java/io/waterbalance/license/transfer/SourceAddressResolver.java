package io.waterbalance.license.transfer;

/**
 * Best-effort lookup of the address a transfer request comes from.
 */
@FunctionalInterface
public interface SourceAddressResolver {

    String UNKNOWN = "unknown";

    /**
     * Resolve the address. Never fails; returns {@link #UNKNOWN} if nothing could be determined.
     */
    String resolve();
}
