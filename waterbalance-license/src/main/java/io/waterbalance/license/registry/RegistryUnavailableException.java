package io.waterbalance.license.registry;

/**
 * The registry could not be reached or gave an unusable answer.
 *
 * <p>This means "unknown", never "invalid": callers fall back to the offline
 * grace window instead of rejecting a cached license.
 */
public class RegistryUnavailableException extends Exception {

    public RegistryUnavailableException(String message) {
        super(message);
    }

    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
