package io.waterbalance.license.hardware;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads hardware identifiers from the operating system.
 *
 * <p>Components (platform-dependent):
 * <ul>
 *   <li>network: first physical adapter MAC, ordered by interface name</li>
 *   <li>cpu: Windows {@code ProcessorId}, Linux {@code /proc/cpuinfo} serial,
 *       macOS {@code machdep.cpu.brand_string}</li>
 *   <li>board: Windows {@code csproduct UUID} / baseboard serial, Linux DMI
 *       board serial or product UUID, macOS {@code IOPlatformUUID}</li>
 * </ul>
 *
 * <p>Every component falls back to a hostname-derived value, so {@link #probe()}
 * never fails and never returns a blank component.
 */
public final class SystemHardwareFingerprinter implements HardwareFingerprinter {

    private static final Logger LOG = Logger.getLogger(SystemHardwareFingerprinter.class.getName());

    private static final long COMMAND_TIMEOUT_SECONDS = 5;

    private final String os;

    public SystemHardwareFingerprinter() {
        this(System.getProperty("os.name", ""));
    }

    SystemHardwareFingerprinter(String osName) {
        this.os = osName.toLowerCase(Locale.ROOT);
    }

    @Override
    public HardwareFingerprint probe() {
        String network = orFallback(readNetworkAddress(), "network");
        String cpu = orFallback(readCpuId(), "cpu");
        String board = orFallback(readBoardId(), "board");

        HardwareFingerprint fingerprint = new HardwareFingerprint(sha256(network), sha256(cpu), sha256(board));
        LOG.fine("Probed " + fingerprint);
        return fingerprint;
    }

    /**
     * Get a short, human-readable machine name for alerts and audit details.
     */
    public static String getMachineName() {
        String hostname = getHostname();
        String osName = System.getProperty("os.name", "Unknown");
        String lower = osName.toLowerCase(Locale.ROOT);

        if (lower.contains("win")) {
            return hostname + " (Windows)";
        } else if (lower.contains("mac")) {
            return hostname + " (macOS)";
        } else if (lower.contains("linux")) {
            return hostname + " (Linux)";
        } else {
            return hostname + " (" + osName + ")";
        }
    }

    /**
     * Lowercase hex SHA-256 of the UTF-8 bytes of {@code input}.
     */
    public static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    String readNetworkAddress() {
        try {
            List<NetworkInterface> interfaces = Collections.list(NetworkInterface.getNetworkInterfaces());
            List<NetworkInterface> candidates = new ArrayList<>();
            for (NetworkInterface ni : interfaces) {
                byte[] mac = ni.getHardwareAddress();
                if (mac != null && mac.length > 0 && !ni.isLoopback() && !ni.isVirtual()) {
                    candidates.add(ni);
                }
            }
            candidates.sort(Comparator.comparing(NetworkInterface::getName));
            if (!candidates.isEmpty()) {
                return HexFormat.of().formatHex(candidates.get(0).getHardwareAddress());
            }
        } catch (IOException | RuntimeException e) {
            LOG.log(Level.FINE, "Network adapter address not readable", e);
        }
        return "";
    }

    String readCpuId() {
        if (os.contains("win")) {
            return valueAfterEquals(run("wmic", "cpu", "get", "ProcessorId", "/value"));
        }
        if (os.contains("linux")) {
            return readCpuInfoSerial();
        }
        if (os.contains("mac")) {
            return run("sysctl", "-n", "machdep.cpu.brand_string");
        }
        return "";
    }

    String readBoardId() {
        if (os.contains("win")) {
            String uuid = valueAfterEquals(run("wmic", "csproduct", "get", "uuid", "/value"));
            if (!uuid.isEmpty()) {
                return uuid;
            }
            return valueAfterEquals(run("wmic", "baseboard", "get", "SerialNumber", "/value"));
        }
        if (os.contains("linux")) {
            for (String candidate : List.of("/sys/class/dmi/id/board_serial", "/sys/class/dmi/id/product_uuid")) {
                String value = readFile(Path.of(candidate));
                if (!value.isEmpty()) {
                    return value;
                }
            }
            // systemd machine id survives reboots and is readable without root
            return readFile(Path.of("/etc/machine-id"));
        }
        if (os.contains("mac")) {
            for (String line : run("ioreg", "-rd1", "-c", "IOPlatformExpertDevice").split("\n")) {
                if (line.contains("IOPlatformUUID")) {
                    int start = line.indexOf('"', line.indexOf('=')) + 1;
                    int end = line.lastIndexOf('"');
                    if (start > 0 && end > start) {
                        return line.substring(start, end);
                    }
                }
            }
        }
        return "";
    }

    private String readCpuInfoSerial() {
        for (String line : readFile(Path.of("/proc/cpuinfo")).split("\n")) {
            if (line.startsWith("Serial")) {
                return valueAfterColon(line);
            }
        }
        return "";
    }

    private static String readFile(Path path) {
        try {
            if (Files.isReadable(path)) {
                return Files.readString(path).trim();
            }
        } catch (IOException e) {
            // DMI files need root on many distributions
            LOG.log(Level.FINE, "Cannot read " + path, e);
        }
        return "";
    }

    private static String run(String... command) {
        try {
            Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
            StringBuilder output = new StringBuilder();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.append(line).append('\n');
                }
            }
            if (!process.waitFor(COMMAND_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return "";
            }
            return process.exitValue() == 0 ? output.toString().trim() : "";
        } catch (IOException e) {
            LOG.log(Level.FINE, "Command failed: " + String.join(" ", command), e);
            return "";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        }
    }

    private static String valueAfterEquals(String output) {
        for (String line : output.split("\n")) {
            int eq = line.indexOf('=');
            if (eq >= 0) {
                return line.substring(eq + 1).trim();
            }
        }
        return "";
    }

    private static String valueAfterColon(String line) {
        int colon = line.indexOf(':');
        return colon >= 0 ? line.substring(colon + 1).trim() : "";
    }

    private static String orFallback(String value, String component) {
        if (value != null && !value.isBlank()) {
            return value.trim();
        }
        String fallback = "host:" + getHostname() + "/" + component;
        LOG.fine("Using hostname fallback for " + component);
        return fallback;
    }

    private static String getHostname() {
        String env = System.getenv("COMPUTERNAME");
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (IOException e) {
            LOG.log(Level.FINE, "Hostname not resolvable", e);
            return env != null && !env.isBlank() ? env : "fallback-node";
        }
    }
}
