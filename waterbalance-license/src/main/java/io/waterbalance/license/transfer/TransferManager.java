package io.waterbalance.license.transfer;

import io.waterbalance.license.HardwareBinding;
import io.waterbalance.license.LicenseError;
import io.waterbalance.license.LicenseRecord;
import io.waterbalance.license.LicenseStatus;
import io.waterbalance.license.audit.AuditEvent;
import io.waterbalance.license.audit.AuditEventType;
import io.waterbalance.license.hardware.HardwareFingerprint;
import io.waterbalance.license.hardware.HardwareFingerprinter;
import io.waterbalance.license.notify.Notifier;
import io.waterbalance.license.notify.OwnerAlert;
import io.waterbalance.license.registry.RegistryUnavailableException;
import io.waterbalance.license.registry.RegistryUpdate;
import io.waterbalance.license.registry.RemoteRecord;
import io.waterbalance.license.registry.RemoteRegistryClient;
import io.waterbalance.license.store.LicenseStoreException;
import io.waterbalance.license.store.LocalLicenseStore;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Moves a license to this machine when its hardware no longer matches the binding.
 *
 * <p>Checks run in a fixed order and the first failure aborts the request:
 * <ol>
 *   <li>the license has transfers left ({@link LicenseRecord#MAX_TRANSFERS} in total)</li>
 *   <li>the email given matches the registered email, ignoring case</li>
 * </ol>
 * An approved request emails the registered owner, rebinds the record to the
 * probed fingerprint, and publishes the change to the registry with the source
 * address. Every request, approved or not, leaves audit entries.
 */
public class TransferManager {

    private static final Logger LOG = Logger.getLogger(TransferManager.class.getName());

    private final RemoteRegistryClient registry;
    private final LocalLicenseStore store;
    private final Notifier notifier;
    private final HardwareFingerprinter fingerprinter;
    private final SourceAddressResolver addressResolver;
    private final Clock clock;
    private final Duration gracePeriod;
    private final int matchThreshold;

    public TransferManager(RemoteRegistryClient registry,
                           LocalLicenseStore store,
                           Notifier notifier,
                           HardwareFingerprinter fingerprinter,
                           SourceAddressResolver addressResolver,
                           Clock clock,
                           Duration gracePeriod,
                           int matchThreshold) {
        this.registry = registry;
        this.store = store;
        this.notifier = notifier;
        this.fingerprinter = fingerprinter;
        this.addressResolver = addressResolver;
        this.clock = clock;
        this.gracePeriod = gracePeriod;
        this.matchThreshold = matchThreshold;
    }

    /**
     * Request that {@code licenseKey} be bound to this machine.
     *
     * @param licenseKey the license key
     * @param email the email the user claims is registered to the license
     * @return the outcome; never throws for expected failures
     */
    public synchronized TransferResult requestTransfer(String licenseKey, String email) {
        Instant now = clock.instant();
        if (licenseKey == null || licenseKey.isBlank() || email == null || email.isBlank()) {
            return TransferResult.denied(LicenseError.INVALID_INPUT,
                "License key and registered email are required", null);
        }
        String key = licenseKey.trim();
        String masked = LicenseRecord.maskKey(key);

        audit(AuditEvent.of(AuditEventType.TRANSFER_REQUESTED, now, key,
            "Transfer requested for " + masked));

        RemoteRecord remote;
        try {
            Optional<RemoteRecord> fetched = registry.fetch(key);
            if (fetched.isEmpty()) {
                return deny(key, LicenseError.NOT_FOUND, "License key not found", null, now);
            }
            remote = fetched.get();
        } catch (RegistryUnavailableException e) {
            LOG.log(Level.WARNING, "Transfer of " + masked + " aborted: registry unavailable", e);
            return deny(key, LicenseError.NETWORK_ERROR,
                "Cannot reach the license registry. Transfers require a connection; try again later.", null, now);
        }

        LocalDate today = LocalDate.ofInstant(now, clock.getZone());
        if (remote.status() == LicenseStatus.REVOKED) {
            return deny(key, LicenseError.REVOKED, "This license has been revoked", null, now);
        }
        if (remote.isExpired(today)) {
            return deny(key, LicenseError.EXPIRED, "This license has expired", null, now);
        }
        if (remote.status() == LicenseStatus.PENDING) {
            return deny(key, LicenseError.INACTIVE, "This license has not been enabled yet", null, now);
        }

        LicenseRecord local = store.load()
            .filter(r -> r.key().equals(key))
            .orElse(null);
        HardwareFingerprint bound = HardwareBinding.effectiveBinding(remote, local);
        if (!bound.isBound()) {
            return deny(key, LicenseError.NOT_ACTIVATED,
                "This license is not bound to any machine yet; activate it instead", local, now);
        }

        HardwareFingerprint probe = fingerprinter.probe();
        if (HardwareBinding.holdsLicense(remote, local, probe, now, matchThreshold)) {
            LOG.info("Transfer of " + masked + " not needed, hardware already matches");
            return TransferResult.notRequired(local);
        }

        // 1. Limit
        int used = Math.max(local != null ? local.transferCount() : 0, remote.transferCount());
        if (used >= LicenseRecord.MAX_TRANSFERS) {
            return deny(key, LicenseError.TRANSFER_LIMIT_EXCEEDED, String.format(
                "Transfer limit reached (%d of %d). Contact support to move this license.",
                used, LicenseRecord.MAX_TRANSFERS), local, now);
        }

        // 2. Email verification against the registered address only
        String registeredEmail = registeredEmail(remote, local);
        String registeredName = remote.licenseeName().isEmpty() && local != null
            ? local.licenseeName() : remote.licenseeName();
        if (registeredEmail.isEmpty()) {
            return deny(key, LicenseError.EMAIL_VERIFICATION_FAILED,
                "No email is registered for this license; contact support", local, now);
        }
        if (!registeredEmail.equalsIgnoreCase(email.trim())) {
            TransferResult denied = deny(key, LicenseError.EMAIL_VERIFICATION_FAILED,
                "Email does not match the registered owner of this license", local, now);
            alert(new OwnerAlert(OwnerAlert.Kind.UNAUTHORIZED_ATTEMPT, registeredEmail, registeredName,
                masked, probe, now, addressResolver.resolve()));
            return denied;
        }

        // 3. Owner notification, never awaited
        String sourceIp = addressResolver.resolve();
        alert(new OwnerAlert(OwnerAlert.Kind.TRANSFER_NOTICE, registeredEmail, registeredName,
            masked, probe, now, sourceIp));

        // 4. Bind and persist
        LicenseRecord base = local != null ? local : fromRemote(remote, now);
        LicenseRecord transferred = base
            .withRemoteTerms(remote.tier(), remote.expiryDate(), used)
            .withTransfer(probe, now, now.plus(gracePeriod));
        try {
            store.save(transferred);
        } catch (LicenseStoreException e) {
            LOG.log(Level.WARNING, "Transfer of " + masked + " could not be saved", e);
            return deny(key, LicenseError.STORAGE_ERROR,
                "The license could not be saved on this machine: " + e.getMessage(), local, now);
        }

        // 5. Audit and registry sync
        audit(new AuditEvent(AuditEventType.TRANSFER_APPROVED, now, key, sourceIp,
            String.format("Transfer %d of %d approved; %s", transferred.transferCount(),
                LicenseRecord.MAX_TRANSFERS, bound.describeMismatch(probe))));
        registry.post(RegistryUpdate.transfer(transferred, sourceIp))
            .thenAccept(ok -> {
                if (!ok) {
                    LOG.warning("Registry did not acknowledge transfer of " + masked);
                }
            });

        LOG.info("License " + masked + " transferred to this machine ("
            + transferred.transferCount() + "/" + LicenseRecord.MAX_TRANSFERS + ")");
        return TransferResult.approved(transferred, sourceIp);
    }

    private TransferResult deny(String key, LicenseError error, String message, LicenseRecord record, Instant now) {
        audit(AuditEvent.of(AuditEventType.TRANSFER_DENIED, now, key, error + ": " + message));
        LOG.info("Transfer of " + LicenseRecord.maskKey(key) + " denied: " + error);
        return TransferResult.denied(error, message, record);
    }

    private void audit(AuditEvent event) {
        try {
            store.appendAudit(event);
        } catch (UncheckedIOException e) {
            LOG.log(Level.WARNING, "Could not write audit event " + event.eventType(), e);
        }
    }

    private void alert(OwnerAlert alert) {
        notifier.notifyOwner(alert).whenComplete((ignored, error) -> {
            if (error != null) {
                LOG.log(Level.WARNING, "Owner alert " + alert.kind() + " for " + alert.maskedKey()
                    + " via " + notifier.getName() + " failed", error);
            }
        });
    }

    private static String registeredEmail(RemoteRecord remote, LicenseRecord local) {
        if (remote.hasRegisteredEmail()) {
            return remote.licenseeEmail();
        }
        if (local != null && local.licenseeEmail() != null) {
            return local.licenseeEmail().trim();
        }
        return "";
    }

    private static LicenseRecord fromRemote(RemoteRecord remote, Instant now) {
        return new LicenseRecord(remote.key(), LicenseStatus.ACTIVE, remote.tier(), remote.bindings(),
            remote.licenseeName(), remote.licenseeEmail(), remote.expiryDate(), remote.transferCount(),
            now, null, null, null, null, 0, now);
    }
}
