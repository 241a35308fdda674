package io.waterbalance.license.transfer;

import io.waterbalance.license.LicenseError;
import io.waterbalance.license.LicenseRecord;
import io.waterbalance.license.LicenseStatus;
import io.waterbalance.license.LicenseTier;
import io.waterbalance.license.audit.AuditEvent;
import io.waterbalance.license.audit.AuditEventType;
import io.waterbalance.license.audit.AuditLog;
import io.waterbalance.license.audit.AuditQuery;
import io.waterbalance.license.hardware.HardwareFingerprint;
import io.waterbalance.license.notify.OwnerAlert;
import io.waterbalance.license.registry.RegistryUpdate;
import io.waterbalance.license.registry.RemoteRecord;
import io.waterbalance.license.store.LocalLicenseStore;
import io.waterbalance.license.support.FakeRegistryClient;
import io.waterbalance.license.support.FixedFingerprinter;
import io.waterbalance.license.support.MutableClock;
import io.waterbalance.license.support.RecordingNotifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static io.waterbalance.license.support.FixedFingerprinter.MACHINE_A;
import static io.waterbalance.license.support.FixedFingerprinter.MACHINE_B;
import static io.waterbalance.license.support.FixedFingerprinter.MACHINE_C;
import static io.waterbalance.license.support.FixedFingerprinter.MACHINE_D;
import static io.waterbalance.license.support.FixedFingerprinter.MACHINE_E;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link TransferManager}.
 */
class TransferManagerTest {

    private static final Instant NOW = Instant.parse("2026-05-02T14:30:00Z");
    private static final String KEY = "WB-PRM-2026-QRST-9876";
    private static final String REGISTERED = "right@x.com";
    private static final String SOURCE_IP = "198.51.100.23";

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private FakeRegistryClient registry;
    private FixedFingerprinter fingerprinter;
    private RecordingNotifier notifier;
    private LocalLicenseStore store;
    private TransferManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW, ZoneOffset.UTC);
        registry = new FakeRegistryClient();
        fingerprinter = new FixedFingerprinter(MACHINE_B);
        notifier = new RecordingNotifier();
        store = new LocalLicenseStore(tempDir);
        manager = new TransferManager(registry, store, notifier, fingerprinter, () -> SOURCE_IP,
            clock, Duration.ofDays(7), 2);

        registry.put(FakeRegistryClient.activeRow(KEY, REGISTERED));
        registry.setBindings(KEY, MACHINE_A);
        store.save(new LicenseRecord(KEY, LicenseStatus.ACTIVE, LicenseTier.PREMIUM, MACHINE_A,
            "Jane Owner", REGISTERED, null, 0, NOW.minus(Duration.ofDays(90)),
            NOW.minus(Duration.ofDays(1)), NOW.plus(Duration.ofDays(6)), null, null, 0,
            NOW.minus(Duration.ofDays(1))));
    }

    private List<AuditEvent> audit(AuditEventType type) {
        return store.auditLog().query(AuditQuery.ofTypes(type).forKey(KEY));
    }

    @Test
    @DisplayName("correct email rebinds the license to this machine")
    void requestTransfer_correctEmail_approved() {
        TransferResult result = manager.requestTransfer(KEY, REGISTERED);

        assertTrue(result.approved());
        assertTrue(result.transferred());
        assertEquals(SOURCE_IP, result.sourceIp());

        LicenseRecord stored = store.load().orElseThrow();
        assertEquals(MACHINE_B, stored.hardwareBindings());
        assertEquals(1, stored.transferCount());
        assertEquals(NOW, stored.lastVerifiedAt());
        assertEquals(NOW, stored.lastTransferAt());
        assertEquals(NOW.plus(Duration.ofDays(7)), stored.offlineGraceUntil());
    }

    @Test
    @DisplayName("approved transfer is audited, announced and published")
    void requestTransfer_approved_auditsNotifiesPublishes() {
        manager.requestTransfer(KEY, REGISTERED);

        assertEquals(1, audit(AuditEventType.TRANSFER_REQUESTED).size());
        List<AuditEvent> approved = audit(AuditEventType.TRANSFER_APPROVED);
        assertEquals(1, approved.size());
        assertEquals(SOURCE_IP, approved.get(0).sourceIp());

        List<OwnerAlert> alerts = notifier.alerts();
        assertEquals(1, alerts.size());
        assertEquals(OwnerAlert.Kind.TRANSFER_NOTICE, alerts.get(0).kind());
        assertEquals(REGISTERED, alerts.get(0).recipientEmail());
        assertEquals(MACHINE_B, alerts.get(0).newFingerprint());
        assertEquals(SOURCE_IP, alerts.get(0).sourceIp());

        List<RegistryUpdate> posts = registry.posts();
        assertEquals(1, posts.size());
        assertTrue(posts.get(0).isTransfer());
        assertEquals(SOURCE_IP, posts.get(0).sourceIp());
        assertEquals(MACHINE_B, posts.get(0).bindings());
    }

    @Test
    @DisplayName("email check ignores case")
    void requestTransfer_emailCaseInsensitive() {
        assertTrue(manager.requestTransfer(KEY, "RIGHT@X.COM").approved());
    }

    @Test
    @DisplayName("fourth transfer is refused and leaves the binding untouched")
    void requestTransfer_fourth_limitExceeded() {
        HardwareFingerprint[] machines = {MACHINE_B, MACHINE_C, MACHINE_D};
        for (HardwareFingerprint machine : machines) {
            fingerprinter.set(machine);
            clock.advance(Duration.ofDays(30));
            assertTrue(manager.requestTransfer(KEY, REGISTERED).approved());
        }
        assertEquals(3, store.load().orElseThrow().transferCount());
        int deniedBefore = audit(AuditEventType.TRANSFER_DENIED).size();

        fingerprinter.set(MACHINE_E);
        TransferResult fourth = manager.requestTransfer(KEY, REGISTERED);

        assertFalse(fourth.approved());
        assertEquals(LicenseError.TRANSFER_LIMIT_EXCEEDED, fourth.error());
        LicenseRecord stored = store.load().orElseThrow();
        assertEquals(MACHINE_D, stored.hardwareBindings());
        assertEquals(3, stored.transferCount());
        assertEquals(deniedBefore + 1, audit(AuditEventType.TRANSFER_DENIED).size());
    }

    @Test
    @DisplayName("limit counts transfers recorded by the registry")
    void requestTransfer_registryCountAtLimit_denied() {
        registry.put(new RemoteRecord(KEY, LicenseStatus.ACTIVE,
            LicenseTier.PREMIUM, null, MACHINE_A, "Jane Owner", REGISTERED, 3, ""));

        TransferResult result = manager.requestTransfer(KEY, REGISTERED);

        assertEquals(LicenseError.TRANSFER_LIMIT_EXCEEDED, result.error());
        assertEquals(MACHINE_A, store.load().orElseThrow().hardwareBindings());
    }

    @Test
    @DisplayName("wrong email is refused without touching the record")
    void requestTransfer_wrongEmail_denied() {
        TransferResult result = manager.requestTransfer(KEY, "wrong@x.com");

        assertFalse(result.approved());
        assertEquals(LicenseError.EMAIL_VERIFICATION_FAILED, result.error());

        LicenseRecord stored = store.load().orElseThrow();
        assertEquals(MACHINE_A, stored.hardwareBindings());
        assertEquals(0, stored.transferCount());
        assertEquals(1, audit(AuditEventType.TRANSFER_DENIED).size());
        assertTrue(audit(AuditEventType.TRANSFER_APPROVED).isEmpty());
        assertTrue(registry.posts().isEmpty());
    }

    @Test
    @DisplayName("wrong email alerts the registered owner, never the typed address")
    void requestTransfer_wrongEmail_alertsRegisteredOwner() {
        manager.requestTransfer(KEY, "wrong@x.com");

        List<OwnerAlert> alerts = notifier.alerts();
        assertEquals(1, alerts.size());
        assertEquals(OwnerAlert.Kind.UNAUTHORIZED_ATTEMPT, alerts.get(0).kind());
        assertEquals(REGISTERED, alerts.get(0).recipientEmail());
    }

    @Test
    @DisplayName("matching hardware needs no transfer")
    void requestTransfer_sameHardware_notRequired() {
        fingerprinter.set(MACHINE_A);

        TransferResult result = manager.requestTransfer(KEY, REGISTERED);

        assertTrue(result.approved());
        assertFalse(result.transferred());
        assertEquals(0, store.load().orElseThrow().transferCount());
        assertTrue(notifier.alerts().isEmpty());
    }

    @Test
    @DisplayName("a stale local binding does not make a transfer unnecessary")
    void requestTransfer_registryBoundElsewhere_transfersBack() {
        registry.put(new RemoteRecord(KEY, LicenseStatus.ACTIVE,
            LicenseTier.PREMIUM, null, MACHINE_B, "Jane Owner", REGISTERED, 1, ""));
        fingerprinter.set(MACHINE_A);

        TransferResult result = manager.requestTransfer(KEY, REGISTERED);

        assertTrue(result.approved());
        assertTrue(result.transferred());
        assertEquals(MACHINE_A, registry.row(KEY).bindings());
        assertEquals(2, store.load().orElseThrow().transferCount());
    }

    @Test
    @DisplayName("a transfer not yet recorded by the registry needs no second transfer")
    void requestTransfer_unpublishedLocalTransfer_notRequired() {
        registry.setLagging(true);
        assertTrue(manager.requestTransfer(KEY, REGISTERED).transferred());
        clock.advance(Duration.ofHours(1));

        TransferResult again = manager.requestTransfer(KEY, REGISTERED);

        assertTrue(again.approved());
        assertFalse(again.transferred());
        assertEquals(1, store.load().orElseThrow().transferCount());
    }

    @Test
    @DisplayName("an unwritable audit log does not fail the transfer")
    void requestTransfer_auditUnwritable_stillApproved() throws IOException {
        Files.createDirectories(tempDir.resolve(AuditLog.AUDIT_FILE));

        TransferResult result = manager.requestTransfer(KEY, REGISTERED);

        assertTrue(result.approved());
        assertEquals(MACHINE_B, store.load().orElseThrow().hardwareBindings());
    }

    @Test
    @DisplayName("an unwritable audit log does not hide a denial")
    void requestTransfer_auditUnwritable_stillDenied() throws IOException {
        Files.createDirectories(tempDir.resolve(AuditLog.AUDIT_FILE));

        assertEquals(LicenseError.EMAIL_VERIFICATION_FAILED,
            manager.requestTransfer(KEY, "wrong@x.com").error());
    }

    @Test
    @DisplayName("registry unreachable fails with NETWORK_ERROR")
    void requestTransfer_offline_networkError() {
        registry.setOffline(true);

        TransferResult result = manager.requestTransfer(KEY, REGISTERED);

        assertEquals(LicenseError.NETWORK_ERROR, result.error());
        assertEquals(MACHINE_A, store.load().orElseThrow().hardwareBindings());
    }

    @Test
    @DisplayName("revoked license cannot be transferred")
    void requestTransfer_revoked_denied() {
        registry.setStatus(KEY, LicenseStatus.REVOKED);

        assertEquals(LicenseError.REVOKED, manager.requestTransfer(KEY, REGISTERED).error());
    }

    @Test
    @DisplayName("unknown key fails with NOT_FOUND")
    void requestTransfer_unknownKey_notFound() {
        assertEquals(LicenseError.NOT_FOUND, manager.requestTransfer("WB-NONE-0000", REGISTERED).error());
    }

    @Test
    @DisplayName("failed owner alert does not block the transfer")
    void requestTransfer_notifierFails_stillApproved() {
        notifier.setFailing(true);

        assertTrue(manager.requestTransfer(KEY, REGISTERED).approved());
        assertEquals(MACHINE_B, store.load().orElseThrow().hardwareBindings());
    }

    @Test
    @DisplayName("transfer onto a fresh install creates the local record")
    void requestTransfer_freshInstall_createsRecord() {
        Path otherDir = tempDir.resolve("fresh");
        LocalLicenseStore freshStore = new LocalLicenseStore(otherDir);
        TransferManager fresh = new TransferManager(registry, freshStore, notifier, fingerprinter,
            () -> SOURCE_IP, clock, Duration.ofDays(7), 2);

        TransferResult result = fresh.requestTransfer(KEY, REGISTERED);

        assertTrue(result.approved());
        LicenseRecord stored = freshStore.load().orElseThrow();
        assertEquals(MACHINE_B, stored.hardwareBindings());
        assertEquals(1, stored.transferCount());
        assertEquals("Jane Owner", stored.licenseeName());
    }

    @Test
    @DisplayName("blank email is rejected as invalid input")
    void requestTransfer_blankEmail_invalidInput() {
        TransferResult result = manager.requestTransfer(KEY, " ");

        assertEquals(LicenseError.INVALID_INPUT, result.error());
        assertNull(result.record());
        assertEquals(0, registry.fetchCalls());
    }
}
