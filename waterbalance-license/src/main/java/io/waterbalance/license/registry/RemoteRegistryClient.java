package io.waterbalance.license.registry;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Access to the vendor's license registry.
 *
 * <p>Reads are anonymous and may be stale. Writes are best-effort: they never
 * block or fail the operation that triggers them.
 *
 * @see HttpRegistryClient
 */
public interface RemoteRegistryClient {

    /**
     * Look up one license.
     *
     * @param licenseKey the license key
     * @return the row, or empty if the registry has no such key
     * @throws RegistryUnavailableException on timeout, connection failure or unusable response
     */
    Optional<RemoteRecord> fetch(String licenseKey) throws RegistryUnavailableException;

    /**
     * Read every row, for recovering a license after a reinstall.
     *
     * @throws RegistryUnavailableException on timeout, connection failure or unusable response
     */
    List<RemoteRecord> fetchAll() throws RegistryUnavailableException;

    /**
     * Send an update without waiting for it. Retried at most once.
     *
     * @return completes with true if the registry acknowledged the update;
     *         never completes exceptionally
     */
    CompletableFuture<Boolean> post(RegistryUpdate update);
}
