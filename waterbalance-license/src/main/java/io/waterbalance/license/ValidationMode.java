package io.waterbalance.license;

/**
 * Which entry point produced a {@link ValidationResult}.
 */
public enum ValidationMode {
    STARTUP,
    BACKGROUND,
    MANUAL,
    ACTIVATION,
    TRANSFER
}
