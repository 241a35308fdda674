package io.waterbalance.license.store;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.waterbalance.license.LicenseRecord;
import io.waterbalance.license.LicenseStatus;
import io.waterbalance.license.LicenseTier;
import io.waterbalance.license.audit.AuditEvent;
import io.waterbalance.license.audit.AuditLog;
import io.waterbalance.license.hardware.HardwareFingerprint;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable local copy of the current {@link LicenseRecord}.
 *
 * <p>Stores the record in {@code license.json} under the data directory and
 * owns the {@link AuditLog} next to it. Writes go to a temporary file that is
 * flushed and then renamed over the old one, so a crash mid-write leaves
 * either the previous record or the new one, never a torn file.
 *
 * <p>One process is the only writer. A lock serializes load-modify-save
 * sequences between the background revalidation thread and user-triggered
 * operations; see {@link #update(UnaryOperator)}.
 */
public class LocalLicenseStore {

    private static final Logger LOG = Logger.getLogger(LocalLicenseStore.class.getName());

    public static final String LICENSE_FILE = "license.json";

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .create();

    private final Path dataDir;
    private final Path licenseFile;
    private final AuditLog auditLog;
    private final ReentrantLock lock = new ReentrantLock();

    public LocalLicenseStore(Path dataDir) {
        this(dataDir, new AuditLog(dataDir));
    }

    public LocalLicenseStore(Path dataDir, AuditLog auditLog) {
        this.dataDir = dataDir;
        this.licenseFile = dataDir.resolve(LICENSE_FILE);
        this.auditLog = auditLog;
    }

    /**
     * Load the stored record.
     *
     * @return the record, or empty if none is stored or the file is unreadable
     */
    public Optional<LicenseRecord> load() {
        lock.lock();
        try {
            return read();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Atomically replace the stored record.
     *
     * @throws LicenseStoreException if the record could not be written
     */
    public void save(LicenseRecord record) {
        lock.lock();
        try {
            write(record);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Load, transform and save the record as one step with respect to other
     * writers in this process.
     *
     * @param mutation applied to the current record
     * @return the saved record, or empty if no record is stored
     * @throws LicenseStoreException if the record could not be written
     */
    public Optional<LicenseRecord> update(UnaryOperator<LicenseRecord> mutation) {
        lock.lock();
        try {
            Optional<LicenseRecord> current = read();
            if (current.isEmpty()) {
                return Optional.empty();
            }
            LicenseRecord updated = mutation.apply(current.get());
            if (!updated.equals(current.get())) {
                write(updated);
            }
            return Optional.of(updated);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Append an event to the audit trail.
     */
    public void appendAudit(AuditEvent event) {
        auditLog.append(event);
    }

    public AuditLog auditLog() {
        return auditLog;
    }

    /**
     * Check if a record is stored.
     */
    public boolean exists() {
        return Files.exists(licenseFile);
    }

    private Optional<LicenseRecord> read() {
        if (!Files.exists(licenseFile)) {
            return Optional.empty();
        }

        try {
            String json = Files.readString(licenseFile);
            StoredLicense stored = GSON.fromJson(json, StoredLicense.class);
            if (stored == null || stored.key == null) {
                return Optional.empty();
            }
            if (stored.status == null || stored.tier == null) {
                LOG.warning("License record in " + licenseFile + " has no status or tier, treating as absent");
                return Optional.empty();
            }

            return Optional.of(new LicenseRecord(
                stored.key,
                LicenseStatus.valueOf(stored.status),
                LicenseTier.valueOf(stored.tier),
                new HardwareFingerprint(stored.hwNetwork, stored.hwCpu, stored.hwBoard),
                stored.licenseeName,
                stored.licenseeEmail,
                stored.expiryDate != null ? LocalDate.parse(stored.expiryDate) : null,
                stored.transferCount,
                parseInstant(stored.activatedAt),
                parseInstant(stored.lastVerifiedAt),
                parseInstant(stored.offlineGraceUntil),
                parseInstant(stored.lastTransferAt),
                stored.manualVerificationDate != null ? LocalDate.parse(stored.manualVerificationDate) : null,
                stored.manualVerificationCount,
                parseInstant(stored.lastSeenAt)
            ));
        } catch (IOException | JsonParseException | DateTimeParseException | IllegalArgumentException e) {
            LOG.log(Level.WARNING, "Unreadable license record in " + licenseFile + ", treating as absent", e);
            return Optional.empty();
        }
    }

    private void write(LicenseRecord record) {
        StoredLicense stored = new StoredLicense();
        stored.key = record.key();
        stored.status = record.status().name();
        stored.tier = record.tier().name();
        stored.hwNetwork = record.hardwareBindings().network();
        stored.hwCpu = record.hardwareBindings().cpu();
        stored.hwBoard = record.hardwareBindings().board();
        stored.licenseeName = record.licenseeName();
        stored.licenseeEmail = record.licenseeEmail();
        stored.expiryDate = record.expiryDate() != null ? record.expiryDate().toString() : null;
        stored.transferCount = record.transferCount();
        stored.activatedAt = format(record.activatedAt());
        stored.lastVerifiedAt = format(record.lastVerifiedAt());
        stored.offlineGraceUntil = format(record.offlineGraceUntil());
        stored.lastTransferAt = format(record.lastTransferAt());
        stored.manualVerificationDate = record.manualVerificationDate() != null
            ? record.manualVerificationDate().toString() : null;
        stored.manualVerificationCount = record.manualVerificationCount();
        stored.lastSeenAt = format(record.lastSeenAt());

        Path tempFile = licenseFile.resolveSibling(LICENSE_FILE + ".tmp");
        try {
            Files.createDirectories(dataDir);
            Files.writeString(tempFile, GSON.toJson(stored));
            try (FileChannel channel = FileChannel.open(tempFile, StandardOpenOption.WRITE)) {
                channel.force(true);
            }
            try {
                Files.move(tempFile, licenseFile,
                    StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.fine("Atomic move not supported in " + dataDir + ", falling back to replace");
                Files.move(tempFile, licenseFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new LicenseStoreException("Failed to save license record to " + licenseFile, e);
        }
        LOG.fine("Saved license record " + record.getMaskedKey() + " (" + record.status() + ")");
    }

    private static Instant parseInstant(String value) {
        return value != null ? Instant.parse(value) : null;
    }

    private static String format(Instant value) {
        return value != null ? value.toString() : null;
    }

    /**
     * Internal structure for JSON serialization.
     */
    private static class StoredLicense {
        String key;
        String status;
        String tier;
        String hwNetwork;
        String hwCpu;
        String hwBoard;
        String licenseeName;
        String licenseeEmail;
        String expiryDate;
        int transferCount;
        String activatedAt;
        String lastVerifiedAt;
        String offlineGraceUntil;
        String lastTransferAt;
        String manualVerificationDate;
        int manualVerificationCount;
        String lastSeenAt;
    }
}
