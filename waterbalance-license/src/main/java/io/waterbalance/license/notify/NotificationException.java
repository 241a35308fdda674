package io.waterbalance.license.notify;

/**
 * An owner alert could not be delivered.
 */
public class NotificationException extends RuntimeException {

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
