package io.waterbalance.license.store;

/**
 * Thrown when the local license record cannot be written durably.
 */
public class LicenseStoreException extends RuntimeException {

    public LicenseStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
