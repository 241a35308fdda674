package io.waterbalance.license.notify;

import java.util.concurrent.CompletableFuture;

/**
 * Sends owner alerts.
 *
 * <p>Delivery is detection, not prevention: callers never wait on or fail
 * because of the returned future.
 */
public interface Notifier {

    /**
     * Queue an alert for delivery.
     *
     * @return completes when the alert was handed to the transport, or
     *         exceptionally with a {@link NotificationException}
     */
    CompletableFuture<Void> notifyOwner(OwnerAlert alert);

    /**
     * Get the notifier name for logging.
     */
    String getName();
}
