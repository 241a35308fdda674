package io.waterbalance.license;

import io.waterbalance.license.audit.AuditEvent;
import io.waterbalance.license.audit.AuditEventType;
import io.waterbalance.license.audit.AuditLog;
import io.waterbalance.license.hardware.HardwareFingerprint;
import io.waterbalance.license.hardware.HardwareFingerprinter;
import io.waterbalance.license.hardware.SystemHardwareFingerprinter;
import io.waterbalance.license.notify.NoOpNotifier;
import io.waterbalance.license.notify.Notifier;
import io.waterbalance.license.notify.SmtpNotifier;
import io.waterbalance.license.registry.HttpRegistryClient;
import io.waterbalance.license.registry.RegistryUnavailableException;
import io.waterbalance.license.registry.RegistryUpdate;
import io.waterbalance.license.registry.RemoteRecord;
import io.waterbalance.license.registry.RemoteRegistryClient;
import io.waterbalance.license.store.LicenseStoreException;
import io.waterbalance.license.store.LocalLicenseStore;
import io.waterbalance.license.transfer.HttpSourceAddressResolver;
import io.waterbalance.license.transfer.SourceAddressResolver;
import io.waterbalance.license.transfer.TransferManager;
import io.waterbalance.license.transfer.TransferResult;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Main entry point for Water Balance license validation.
 *
 * <p>Construct one instance per process and hand it to the shell and to the
 * {@link LicenseBackgroundScheduler}. All operations return typed results;
 * none of them throws for an expected failure.
 *
 * <p>Usage:
 * <pre>{@code
 * LicenseValidator validator = LicenseValidator.create(LicenseConfig.fromEnvironment());
 *
 * ValidationResult startup = validator.validateStartup();
 * if (startup.requiresBlocking()) {
 *     showActivationDialog(startup.message());
 * }
 *
 * LicenseBackgroundScheduler scheduler = new LicenseBackgroundScheduler(validator, this::showWarning);
 * scheduler.start();
 * }</pre>
 *
 * <p>A network failure is never read as "invalid": it falls back to the
 * offline grace window. A revocation seen online is terminal regardless of
 * any grace left, and is remembered locally so later offline checks fail too.
 */
public class LicenseValidator {

    private static final Logger LOG = Logger.getLogger(LicenseValidator.class.getName());

    /**
     * How far the clock may run behind the last time the license was seen before offline use is refused.
     */
    static final Duration CLOCK_TOLERANCE = Duration.ofMinutes(5);

    private final LicenseConfig config;
    private final LocalLicenseStore store;
    private final RemoteRegistryClient registry;
    private final HardwareFingerprinter fingerprinter;
    private final TransferManager transferManager;
    private final Clock clock;

    private LicenseState state = LicenseState.UNLICENSED;

    public LicenseValidator(LicenseConfig config,
                            LocalLicenseStore store,
                            RemoteRegistryClient registry,
                            HardwareFingerprinter fingerprinter,
                            Notifier notifier,
                            SourceAddressResolver addressResolver,
                            Clock clock) {
        this.config = config;
        this.store = store;
        this.registry = registry;
        this.fingerprinter = fingerprinter;
        this.clock = clock;
        this.transferManager = new TransferManager(registry, store, notifier, fingerprinter,
            addressResolver, clock, config.gracePeriod(), config.matchThreshold());
    }

    /**
     * Wire a validator against the real machine, registry and mail transport.
     */
    public static LicenseValidator create(LicenseConfig config) {
        RemoteRegistryClient registry = new HttpRegistryClient(
            config.registryUrl(), config.webhookUrl(), config.apiKey(), config.timeout());
        Notifier notifier = config.smtp().isConfigured()
            ? new SmtpNotifier(config.smtp())
            : new NoOpNotifier();
        LOG.fine("Creating license validator: " + config + ", notifier=" + notifier.getName());
        return new LicenseValidator(
            config,
            new LocalLicenseStore(config.dataDir()),
            registry,
            new SystemHardwareFingerprinter(),
            notifier,
            new HttpSourceAddressResolver(config.ipLookupUrl(), config.timeout()),
            Clock.systemDefaultZone()
        );
    }

    // ===== Activation =====

    /**
     * Activate a license key on this machine.
     *
     * <p>Requires the registry row to be active and unexpired. Repeating the
     * call for the same key on the same machine rebinds to the same hardware
     * and never consumes a transfer.
     *
     * @param licenseKey the license key
     * @param name licensee name, used only if the registry has none
     * @param email licensee email, used only if the registry has none
     */
    public ValidationResult activate(String licenseKey, String name, String email) {
        ValidationMode mode = ValidationMode.ACTIVATION;
        if (licenseKey == null || licenseKey.isBlank()) {
            return ValidationResult.failure(currentState(), LicenseError.INVALID_INPUT,
                "Please enter a license key", null, mode);
        }
        String key = licenseKey.trim();
        String masked = LicenseRecord.maskKey(key);
        Instant now = clock.instant();
        moveTo(LicenseState.ACTIVATING);

        RemoteRecord remote;
        try {
            Optional<RemoteRecord> fetched = registry.fetch(key);
            if (fetched.isEmpty()) {
                return fail(LicenseState.REJECTED, LicenseError.NOT_FOUND, key,
                    "License key " + masked + " was not found. Check the key or contact " + config.supportEmail(),
                    null, mode, now);
            }
            remote = fetched.get();
        } catch (RegistryUnavailableException e) {
            LOG.log(Level.WARNING, "Activation of " + masked + " failed: registry unavailable", e);
            return fail(LicenseState.REJECTED, LicenseError.NETWORK_ERROR, key,
                "Cannot reach the license registry. Activation requires an internet connection.",
                null, mode, now);
        }

        if (remote.status() == LicenseStatus.REVOKED) {
            return fail(LicenseState.REJECTED, LicenseError.REVOKED, key,
                "This license has been revoked. Contact " + config.supportEmail(), null, mode, now);
        }
        if (remote.isExpired(today(now))) {
            return fail(LicenseState.REJECTED, LicenseError.EXPIRED, key,
                "This license expired on " + remote.expiryDate() + ". Please renew.", null, mode, now);
        }
        if (remote.status() != LicenseStatus.ACTIVE) {
            return fail(LicenseState.REJECTED, LicenseError.INACTIVE, key,
                "This license has not been enabled yet. Contact " + config.supportEmail(), null, mode, now);
        }

        LicenseRecord existing = store.load().filter(r -> r.key().equals(key)).orElse(null);
        HardwareFingerprint probe = fingerprinter.probe();
        if (!HardwareBinding.mayActivate(remote, probe, config.matchThreshold())) {
            return fail(LicenseState.REJECTED, LicenseError.HARDWARE_MISMATCH, key,
                "This license is already in use on another machine ("
                    + remote.bindings().describeMismatch(probe)
                    + "). Use a license transfer to move it here.", existing, mode, now);
        }

        LicenseRecord record = new LicenseRecord(
            key,
            LicenseStatus.ACTIVE,
            remote.tier(),
            probe,
            remote.licenseeName().isEmpty() ? nullToEmpty(name) : remote.licenseeName(),
            remote.hasRegisteredEmail() ? remote.licenseeEmail() : nullToEmpty(email),
            remote.expiryDate(),
            Math.max(existing != null ? existing.transferCount() : 0, remote.transferCount()),
            existing != null && existing.activatedAt() != null ? existing.activatedAt() : now,
            now,
            now.plus(config.gracePeriod()),
            existing != null ? existing.lastTransferAt() : null,
            existing != null ? existing.manualVerificationDate() : null,
            existing != null ? existing.manualVerificationCount() : 0,
            now
        );

        try {
            store.save(record);
        } catch (LicenseStoreException e) {
            LOG.log(Level.WARNING, "Activation of " + masked + " could not be saved", e);
            return fail(LicenseState.REJECTED, LicenseError.STORAGE_ERROR, key,
                "The license could not be saved on this machine: " + e.getMessage(), null, mode, now);
        }
        audit(AuditEventType.ACTIVATE, now, key, (existing != null ? "Re-activated on " : "Activated on ")
            + SystemHardwareFingerprinter.getMachineName());
        publish(RegistryUpdate.activation(record));

        moveTo(LicenseState.ACTIVE);
        LOG.info("License " + masked + " activated (" + record.tier().getDisplayName() + ")");
        return success(record, mode, "License activated for " + displayName(record), now);
    }

    // ===== Validation =====

    /**
     * Validate at application start. Always checks online; with no local
     * record, tries to recover a license already bound to this machine.
     */
    public ValidationResult validateStartup() {
        Optional<LicenseRecord> stored = store.load();
        if (stored.isEmpty()) {
            return autoRecover();
        }
        return check(stored.get(), ValidationMode.STARTUP);
    }

    /**
     * Periodic revalidation. Failures are passive warnings; this never blocks the shell.
     */
    public ValidationResult validateBackground() {
        Optional<LicenseRecord> stored = store.load();
        if (stored.isEmpty()) {
            return ValidationResult.failure(currentState(), LicenseError.NOT_ACTIVATED,
                "No license is activated on this machine", null, ValidationMode.BACKGROUND);
        }
        return check(stored.get(), ValidationMode.BACKGROUND);
    }

    /**
     * User-triggered revalidation, limited per local calendar day. Over the
     * limit, returns {@link LicenseError#RATE_LIMITED} without contacting the registry.
     */
    public ValidationResult validateManual() {
        Instant now = clock.instant();
        LocalDate today = today(now);
        int limit = config.manualLimit();
        AtomicBoolean limited = new AtomicBoolean(false);

        Optional<LicenseRecord> counted;
        try {
            counted = store.update(r -> {
                int used = r.manualVerificationsOn(today);
                if (used >= limit) {
                    limited.set(true);
                    return r;
                }
                return r.withManualVerification(today, used + 1);
            });
        } catch (LicenseStoreException e) {
            LOG.log(Level.WARNING, "Could not record manual verification", e);
            return ValidationResult.failure(currentState(), LicenseError.STORAGE_ERROR,
                "License data could not be saved: " + e.getMessage(), null, ValidationMode.MANUAL);
        }

        if (counted.isEmpty()) {
            return ValidationResult.failure(currentState(), LicenseError.NOT_ACTIVATED,
                "No license is activated on this machine", null, ValidationMode.MANUAL);
        }
        LicenseRecord record = counted.get();
        if (limited.get()) {
            audit(AuditEventType.VALIDATE_FAIL, now, record.key(), "MANUAL: daily limit of " + limit + " reached");
            return ValidationResult.rateLimited(currentState(), record, String.format(
                "Manual verification limit reached (%d per day). Try again after midnight.", limit));
        }
        return check(record, ValidationMode.MANUAL);
    }

    // ===== Transfer =====

    /**
     * Move the license to this machine. See {@link TransferManager}.
     */
    public TransferResult requestTransfer(String licenseKey, String email) {
        TransferResult result = transferManager.requestTransfer(licenseKey, email);
        if (result.approved() && result.transferred()) {
            moveTo(LicenseState.ACTIVE);
        }
        return result;
    }

    // ===== Status =====

    /**
     * Summary for display.
     */
    public LicenseStatusView getStatus() {
        Optional<LicenseRecord> stored = store.load();
        LicenseState current = currentState();
        if (stored.isEmpty()) {
            return LicenseStatusView.unlicensed(current);
        }
        LicenseRecord record = stored.get();
        LocalDate today = today(clock.instant());
        return new LicenseStatusView(
            statusText(record, current, today),
            record.daysToExpiry(today),
            record.transferCount(),
            LicenseRecord.MAX_TRANSFERS,
            record.tier(),
            current,
            record.getMaskedKey(),
            record.lastVerifiedAt(),
            record.offlineGraceUntil()
        );
    }

    public ManualVerificationQuota manualVerificationQuota() {
        Instant now = clock.instant();
        LocalDate today = today(now);
        int used = store.load().map(r -> r.manualVerificationsOn(today)).orElse(0);
        Instant resetsAt = today.plusDays(1).atStartOfDay(clock.getZone()).toInstant();
        return new ManualVerificationQuota(Math.min(used, config.manualLimit()), config.manualLimit(), resetsAt);
    }

    public synchronized LicenseState currentState() {
        return state;
    }

    /**
     * Background revalidation interval for the stored license's tier.
     */
    public Duration checkInterval() {
        return store.load()
            .map(r -> r.tier().getCheckInterval())
            .orElse(LicenseTier.STANDARD.getCheckInterval());
    }

    public AuditLog auditLog() {
        return store.auditLog();
    }

    // ===== Internals =====

    private ValidationResult autoRecover() {
        ValidationMode mode = ValidationMode.STARTUP;
        Instant now = clock.instant();
        LocalDate today = today(now);

        List<RemoteRecord> rows;
        try {
            rows = registry.fetchAll();
        } catch (RegistryUnavailableException e) {
            LOG.log(Level.WARNING, "License recovery skipped: registry unavailable", e);
            return ValidationResult.failure(currentState(), LicenseError.NOT_ACTIVATED,
                "No license is activated on this machine. Connect to the internet and enter your license key.",
                null, mode);
        }

        HardwareFingerprint probe = fingerprinter.probe();
        RemoteRecord recoverable = null;
        RemoteRecord revoked = null;
        for (RemoteRecord row : rows) {
            if (!row.hasBinding() || !HardwareFingerprinter.matches(probe, row.bindings(), config.matchThreshold())) {
                continue;
            }
            if (row.status() == LicenseStatus.REVOKED) {
                revoked = revoked == null ? row : revoked;
            } else if (row.status() == LicenseStatus.ACTIVE && !row.isExpired(today) && recoverable == null) {
                recoverable = row;
            }
        }

        if (recoverable == null) {
            if (revoked != null) {
                return fail(LicenseState.REVOKED, LicenseError.REVOKED, revoked.key(),
                    "The license registered to this machine has been revoked. Contact " + config.supportEmail(),
                    null, mode, now);
            }
            LOG.fine("No registry row matches this machine (" + rows.size() + " rows scanned)");
            return ValidationResult.failure(currentState(), LicenseError.NOT_ACTIVATED,
                "No license is activated on this machine. Enter your license key to activate.", null, mode);
        }

        LicenseRecord record = new LicenseRecord(
            recoverable.key(),
            LicenseStatus.ACTIVE,
            recoverable.tier(),
            recoverable.bindings(),
            recoverable.licenseeName(),
            recoverable.licenseeEmail(),
            recoverable.expiryDate(),
            recoverable.transferCount(),
            now,
            now,
            now.plus(config.gracePeriod()),
            null,
            null,
            0,
            now
        );
        try {
            store.save(record);
        } catch (LicenseStoreException e) {
            LOG.log(Level.WARNING, "Recovered license could not be saved", e);
            return fail(LicenseState.REJECTED, LicenseError.STORAGE_ERROR, record.key(),
                "The license could not be saved on this machine: " + e.getMessage(), null, mode, now);
        }
        audit(AuditEventType.ACTIVATE, now, record.key(),
            "Auto-recovered (" + probe.matchCount(recoverable.bindings()) + "/"
                + HardwareFingerprint.COMPONENT_COUNT + " components matched)");
        moveTo(LicenseState.ACTIVE);
        LOG.info("Recovered license " + record.getMaskedKey() + " bound to this machine");
        return success(record, mode, "License recovered for " + displayName(record), now);
    }

    /**
     * The online check shared by startup, background and manual validation.
     */
    private ValidationResult check(LicenseRecord local, ValidationMode mode) {
        Instant now = clock.instant();
        LocalDate today = today(now);
        String key = local.key();
        String masked = local.getMaskedKey();

        RemoteRecord remote;
        try {
            Optional<RemoteRecord> fetched = registry.fetch(key);
            if (fetched.isEmpty()) {
                touch(now);
                return fail(LicenseState.REJECTED, LicenseError.NOT_FOUND, key,
                    "License key " + masked + " is no longer registered. Contact " + config.supportEmail(),
                    local, mode, now);
            }
            remote = fetched.get();
        } catch (RegistryUnavailableException e) {
            LOG.warning(mode + " validation of " + masked + ": registry unavailable (" + e.getMessage() + ")");
            return offline(local, mode, now, today);
        }

        if (remote.status() == LicenseStatus.REVOKED) {
            LicenseRecord revoked = persist(r -> r.withStatus(LicenseStatus.REVOKED).withLastSeen(now))
                .orElse(local.withStatus(LicenseStatus.REVOKED));
            if (local.status() != LicenseStatus.REVOKED) {
                audit(AuditEventType.REVOKED_DETECTED, now, key, mode + ": registry reports revoked");
            }
            return fail(LicenseState.REVOKED, LicenseError.REVOKED, key,
                "This license has been revoked. Contact " + config.supportEmail(), revoked, mode, now);
        }
        if (remote.isExpired(today)) {
            LicenseRecord expired = persist(r -> r.withRemoteTerms(remote.tier(), remote.expiryDate(),
                    remote.transferCount()).withStatus(LicenseStatus.EXPIRED).withLastSeen(now))
                .orElse(local.withStatus(LicenseStatus.EXPIRED));
            return fail(LicenseState.EXPIRED, LicenseError.EXPIRED, key,
                "This license expired on " + (remote.expiryDate() != null ? remote.expiryDate() : expired.expiryDate())
                    + ". Please renew.", expired, mode, now);
        }
        if (remote.status() == LicenseStatus.PENDING) {
            if (local.status() == LicenseStatus.ACTIVE) {
                // A lagging registry row; treat as unknown rather than a regression
                LOG.warning(mode + " validation of " + masked + ": registry lists license as pending");
                return offline(local, mode, now, today);
            }
            touch(now);
            return fail(LicenseState.REJECTED, LicenseError.INACTIVE, key,
                "This license has not been enabled yet. Contact " + config.supportEmail(), local, mode, now);
        }

        HardwareFingerprint probe = fingerprinter.probe();
        if (!HardwareBinding.holdsLicense(remote, local, probe, now, config.matchThreshold())) {
            touch(now);
            HardwareFingerprint bound = HardwareBinding.effectiveBinding(remote, local);
            return fail(LicenseState.REJECTED, LicenseError.HARDWARE_MISMATCH, key,
                "This license is bound to different hardware (" + bound.describeMismatch(probe)
                    + "). Use a license transfer to move it to this machine.", local, mode, now);
        }

        Instant graceUntil = now.plus(config.gracePeriod());
        UnaryOperator<LicenseRecord> verify = r -> r
            .withRemoteTerms(remote.tier(), remote.expiryDate(), remote.transferCount())
            .withVerification(now, graceUntil);
        LicenseRecord verified = persist(verify).orElseGet(() -> verify.apply(local));

        audit(AuditEventType.VALIDATE_OK, now, key, mode + ": verified online");
        moveTo(LicenseState.ACTIVE);
        LOG.fine(mode + " validation of " + masked + " succeeded");
        return success(verified, mode, "License valid", now);
    }

    private ValidationResult offline(LicenseRecord local, ValidationMode mode, Instant now, LocalDate today) {
        String key = local.key();
        if (local.status() == LicenseStatus.REVOKED) {
            return fail(LicenseState.REVOKED, LicenseError.REVOKED, key,
                "This license has been revoked. Contact " + config.supportEmail(), local, mode, now);
        }

        Instant highWater = local.clockHighWaterMark();
        if (highWater != null && now.isBefore(highWater.minus(CLOCK_TOLERANCE))) {
            return fail(LicenseState.REJECTED, LicenseError.CLOCK_TAMPERED, key,
                "The system clock is behind the last recorded license check (" + highWater
                    + "). Correct the clock or connect to the internet.", local, mode, now);
        }

        if (local.status() == LicenseStatus.EXPIRED || local.isExpired(today)) {
            return fail(LicenseState.EXPIRED, LicenseError.EXPIRED, key,
                "This license expired on " + local.expiryDate() + ". Please renew.", local, mode, now);
        }

        if (local.isWithinGrace(now)) {
            LicenseRecord seen = touch(now).orElse(local);
            LocalDate graceEnd = LocalDate.ofInstant(local.offlineGraceUntil(), clock.getZone());
            long daysLeft = Duration.between(now, local.offlineGraceUntil()).toDays();
            audit(AuditEventType.VALIDATE_OK, now, key, mode + ": offline grace until " + local.offlineGraceUntil());
            moveTo(LicenseState.OFFLINE_GRACE);
            return ValidationResult.offlineGrace(seen, mode, String.format(
                "Offline grace active until %s (%d days left). Connect to the internet to revalidate.",
                graceEnd, daysLeft));
        }

        touch(now);
        String ended = local.offlineGraceUntil() != null
            ? " on " + LocalDate.ofInstant(local.offlineGraceUntil(), clock.getZone())
            : "";
        return fail(LicenseState.REJECTED, LicenseError.OFFLINE_EXPIRED, key,
            "The offline grace period ended" + ended + ". Connect to the internet to revalidate your license.",
            local, mode, now);
    }

    private ValidationResult success(LicenseRecord record, ValidationMode mode, String message, Instant now) {
        Long days = record.daysToExpiry(today(now));
        if (days != null && days <= LicenseRecord.EXPIRY_WARNING_DAYS) {
            String warning = days == 0 ? "License expires today. Please renew."
                : String.format("License expires in %d day%s. Please renew.", days, days == 1 ? "" : "s");
            return ValidationResult.activeWithWarning(record, mode, warning);
        }
        return ValidationResult.active(record, mode, message);
    }

    private ValidationResult fail(LicenseState target, LicenseError error, String key, String message,
                                  LicenseRecord record, ValidationMode mode, Instant now) {
        audit(AuditEventType.VALIDATE_FAIL, now, key, mode + ": " + error);
        moveTo(target);
        LOG.info(mode + " " + error + " for " + LicenseRecord.maskKey(key));
        return ValidationResult.failure(target, error, message, record, mode);
    }

    /**
     * Apply a change to the stored record. A failed write is logged; the
     * online result still stands, only the offline cache is stale.
     */
    private Optional<LicenseRecord> persist(UnaryOperator<LicenseRecord> mutation) {
        try {
            return store.update(mutation);
        } catch (LicenseStoreException e) {
            LOG.log(Level.WARNING, "License record could not be updated", e);
            return Optional.empty();
        }
    }

    private Optional<LicenseRecord> touch(Instant now) {
        return persist(r -> r.withLastSeen(now));
    }

    private void audit(AuditEventType type, Instant now, String key, String details) {
        try {
            store.appendAudit(AuditEvent.of(type, now, key, details));
        } catch (UncheckedIOException e) {
            LOG.log(Level.WARNING, "Audit event " + type + " could not be written", e);
        }
    }

    private void publish(RegistryUpdate update) {
        registry.post(update).thenAccept(ok -> {
            if (!ok) {
                LOG.warning("Registry did not acknowledge " + update);
            }
        });
    }

    private synchronized void moveTo(LicenseState target) {
        if (target == state) {
            return;
        }
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal license state transition " + state + " -> " + target);
        }
        LOG.fine("License state " + state + " -> " + target);
        state = target;
    }

    private LocalDate today(Instant now) {
        return LocalDate.ofInstant(now, clock.getZone());
    }

    private String statusText(LicenseRecord record, LicenseState current, LocalDate today) {
        switch (record.status()) {
            case REVOKED:
                return "Revoked";
            case EXPIRED:
                return "Expired";
            case PENDING:
                return "Pending activation";
            default:
                break;
        }
        if (record.isExpired(today)) {
            return "Expired";
        }
        String text = record.tier().getDisplayName() + " license active";
        if (current == LicenseState.OFFLINE_GRACE && record.offlineGraceUntil() != null) {
            text += " (offline grace until " + LocalDate.ofInstant(record.offlineGraceUntil(), clock.getZone()) + ")";
        } else if (current == LicenseState.REJECTED) {
            text += " (last check failed)";
        }
        return text;
    }

    private static String displayName(LicenseRecord record) {
        return record.licenseeName() == null || record.licenseeName().isBlank()
            ? record.getMaskedKey() : record.licenseeName();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
