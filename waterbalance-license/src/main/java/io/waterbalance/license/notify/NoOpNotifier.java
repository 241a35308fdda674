package io.waterbalance.license.notify;

import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Notifier used when no mail transport is configured.
 *
 * <p>Alerts are logged instead of sent, so transfers still go through.
 */
public class NoOpNotifier implements Notifier {

    private static final Logger LOG = Logger.getLogger(NoOpNotifier.class.getName());

    @Override
    public CompletableFuture<Void> notifyOwner(OwnerAlert alert) {
        LOG.warning("No mail transport configured; owner alert " + alert.kind()
            + " for " + alert.maskedKey() + " was not sent to " + alert.recipientEmail());
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public String getName() {
        return "None (not configured)";
    }
}
