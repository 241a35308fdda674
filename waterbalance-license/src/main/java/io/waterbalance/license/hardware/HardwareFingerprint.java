package io.waterbalance.license.hardware;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Hashed hardware identity of a machine.
 *
 * <p>Each component is the lowercase hex SHA-256 of a best-effort OS identifier.
 * A component may be blank when it was read from a registry row that has no
 * binding yet; a probed fingerprint always has all three.
 *
 * @param network hash of the primary network adapter address
 * @param cpu hash of the CPU serial / processor id
 * @param board hash of the board serial or system UUID
 */
public record HardwareFingerprint(String network, String cpu, String board) {

    public static final int COMPONENT_COUNT = 3;

    public HardwareFingerprint {
        network = normalize(network);
        cpu = normalize(cpu);
        board = normalize(board);
    }

    /**
     * A fingerprint with no components, used for registry rows without a binding.
     */
    public static HardwareFingerprint unbound() {
        return new HardwareFingerprint("", "", "");
    }

    /**
     * Components in their fixed order: network, cpu, board.
     */
    public List<String> components() {
        return List.of(network, cpu, board);
    }

    /**
     * True if at least one component is present.
     */
    public boolean isBound() {
        return !network.isEmpty() || !cpu.isEmpty() || !board.isEmpty();
    }

    /**
     * Number of components that are present on both sides and equal.
     */
    public int matchCount(HardwareFingerprint other) {
        int count = 0;
        if (same(network, other.network)) count++;
        if (same(cpu, other.cpu)) count++;
        if (same(board, other.board)) count++;
        return count;
    }

    /**
     * Human-readable list of the components that differ, for remediation messages.
     */
    public String describeMismatch(HardwareFingerprint other) {
        List<String> changed = new ArrayList<>();
        if (differs(network, other.network)) changed.add("Network adapter changed");
        if (differs(cpu, other.cpu)) changed.add("CPU changed");
        if (differs(board, other.board)) changed.add("Board changed");
        return changed.isEmpty() ? "No mismatch details available" : String.join(", ", changed);
    }

    /**
     * Short prefix of a component for logs and alerts; never the full hash.
     */
    public static String abbreviate(String component) {
        if (component == null || component.isEmpty()) {
            return "(none)";
        }
        return component.length() <= 12 ? component : component.substring(0, 12) + "...";
    }

    @Override
    public String toString() {
        return "HardwareFingerprint[network=" + abbreviate(network)
            + ", cpu=" + abbreviate(cpu)
            + ", board=" + abbreviate(board) + "]";
    }

    private static boolean same(String a, String b) {
        return !a.isEmpty() && !b.isEmpty() && a.equals(b);
    }

    private static boolean differs(String a, String b) {
        return !a.isEmpty() && !b.isEmpty() && !a.equals(b);
    }

    private static String normalize(String component) {
        return component == null ? "" : component.trim().toLowerCase(Locale.ROOT);
    }
}
