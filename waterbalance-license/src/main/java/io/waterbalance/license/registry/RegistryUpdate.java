package io.waterbalance.license.registry;

import com.google.gson.annotations.SerializedName;
import io.waterbalance.license.LicenseRecord;
import io.waterbalance.license.hardware.HardwareFingerprint;

/**
 * Body of a registry write: an idempotent upsert keyed by license key.
 *
 * <p>Field names are the registry's wire names.
 */
public final class RegistryUpdate {

    @SerializedName("license_key")
    private final String licenseKey;

    @SerializedName("status")
    private final String status;

    @SerializedName("hw1")
    private final String hw1;

    @SerializedName("hw2")
    private final String hw2;

    @SerializedName("hw3")
    private final String hw3;

    @SerializedName("licensee_name")
    private final String licenseeName;

    @SerializedName("licensee_email")
    private final String licenseeEmail;

    @SerializedName("license_tier")
    private final String licenseTier;

    @SerializedName("is_transfer")
    private final boolean transfer;

    @SerializedName("event_type")
    private final String eventType;

    @SerializedName("source_ip")
    private final String sourceIp;

    private RegistryUpdate(LicenseRecord record, boolean transfer, String sourceIp) {
        HardwareFingerprint hw = record.hardwareBindings();
        this.licenseKey = record.key();
        this.status = record.status().wireName();
        this.hw1 = hw.network();
        this.hw2 = hw.cpu();
        this.hw3 = hw.board();
        this.licenseeName = record.licenseeName() != null ? record.licenseeName() : "";
        this.licenseeEmail = record.licenseeEmail() != null ? record.licenseeEmail() : "";
        this.licenseTier = record.tier().wireName();
        this.transfer = transfer;
        this.eventType = transfer ? "transfer" : "activate";
        this.sourceIp = sourceIp;
    }

    /**
     * Publish the binding created by an activation.
     */
    public static RegistryUpdate activation(LicenseRecord record) {
        return new RegistryUpdate(record, false, null);
    }

    /**
     * Publish a transfer; the registry increments its transfer count.
     */
    public static RegistryUpdate transfer(LicenseRecord record, String sourceIp) {
        return new RegistryUpdate(record, true, sourceIp);
    }

    public String licenseKey() {
        return licenseKey;
    }

    public String status() {
        return status;
    }

    public HardwareFingerprint bindings() {
        return new HardwareFingerprint(hw1, hw2, hw3);
    }

    public String licenseeName() {
        return licenseeName;
    }

    public String licenseeEmail() {
        return licenseeEmail;
    }

    public String licenseTier() {
        return licenseTier;
    }

    public boolean isTransfer() {
        return transfer;
    }

    public String sourceIp() {
        return sourceIp;
    }

    @Override
    public String toString() {
        return "RegistryUpdate[" + LicenseRecord.maskKey(licenseKey) + ", " + eventType + "]";
    }
}
