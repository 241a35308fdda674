package io.waterbalance.license.support;

import io.waterbalance.license.notify.NotificationException;
import io.waterbalance.license.notify.Notifier;
import io.waterbalance.license.notify.OwnerAlert;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Notifier that keeps every alert; can be told to fail delivery.
 */
public class RecordingNotifier implements Notifier {

    private final List<OwnerAlert> alerts = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public List<OwnerAlert> alerts() {
        return List.copyOf(alerts);
    }

    @Override
    public CompletableFuture<Void> notifyOwner(OwnerAlert alert) {
        alerts.add(alert);
        if (failing) {
            return CompletableFuture.failedFuture(
                new NotificationException("Mail server unavailable", null));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public String getName() {
        return "Recording";
    }
}
