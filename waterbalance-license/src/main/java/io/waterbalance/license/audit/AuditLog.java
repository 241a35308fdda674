package io.waterbalance.license.audit;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Append-only audit trail of licensing events.
 *
 * <p>Stored as one JSON object per line in {@code audit.jsonl} under the data
 * directory. The file is only ever opened in append mode; there is no
 * operation that rewrites or removes a past entry.
 */
public class AuditLog {

    private static final Logger LOG = Logger.getLogger(AuditLog.class.getName());

    public static final String AUDIT_FILE = "audit.jsonl";

    private static final Gson GSON = new Gson();

    private final Path dataDir;
    private final Path auditFile;
    private final Object appendLock = new Object();

    public AuditLog(Path dataDir) {
        this.dataDir = dataDir;
        this.auditFile = dataDir.resolve(AUDIT_FILE);
    }

    /**
     * Append an event and force it to disk.
     *
     * @throws UncheckedIOException if the entry could not be written
     */
    public void append(AuditEvent event) {
        AuditLine line = new AuditLine();
        line.eventType = event.eventType().name();
        line.timestamp = event.timestamp().toString();
        line.licenseKey = event.licenseKey();
        line.sourceIp = event.sourceIp();
        line.details = event.details();

        byte[] bytes = (GSON.toJson(line) + "\n").getBytes(StandardCharsets.UTF_8);

        synchronized (appendLock) {
            try {
                Files.createDirectories(dataDir);
                try (FileChannel channel = FileChannel.open(auditFile,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                    ByteBuffer buffer = ByteBuffer.wrap(bytes);
                    while (buffer.hasRemaining()) {
                        channel.write(buffer);
                    }
                    channel.force(false);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append audit event " + event.eventType(), e);
            }
        }
        LOG.fine("Audit " + event.eventType() + ": " + event.details());
    }

    /**
     * All events in append order.
     */
    public List<AuditEvent> query() {
        return query(AuditQuery.all());
    }

    /**
     * Events matching {@code filter}, in append order. The returned list is unmodifiable.
     */
    public List<AuditEvent> query(AuditQuery filter) {
        List<String> lines;
        synchronized (appendLock) {
            if (!Files.exists(auditFile)) {
                return List.of();
            }
            try {
                lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read audit log " + auditFile, e);
            }
        }

        List<AuditEvent> events = new ArrayList<>();
        int lineNumber = 0;
        for (String raw : lines) {
            lineNumber++;
            if (raw.isBlank()) {
                continue;
            }
            AuditEvent event = parse(raw, lineNumber);
            if (event != null && filter.matches(event)) {
                events.add(event);
            }
        }
        return List.copyOf(events);
    }

    /**
     * Number of well-formed entries.
     */
    public int size() {
        return query().size();
    }

    private AuditEvent parse(String raw, int lineNumber) {
        try {
            AuditLine line = GSON.fromJson(raw, AuditLine.class);
            if (line == null || line.eventType == null || line.timestamp == null) {
                LOG.warning("Skipping incomplete audit entry at line " + lineNumber);
                return null;
            }
            return new AuditEvent(
                AuditEventType.valueOf(line.eventType),
                Instant.parse(line.timestamp),
                line.licenseKey,
                line.sourceIp,
                line.details
            );
        } catch (JsonParseException | DateTimeParseException | IllegalArgumentException e) {
            // A torn final line after a crash is expected; keep reading the rest
            LOG.warning("Skipping malformed audit entry at line " + lineNumber + ": " + e.getMessage());
            return null;
        }
    }

    /**
     * Internal structure for JSON serialization.
     */
    private static class AuditLine {
        String eventType;
        String timestamp;
        String licenseKey;
        String sourceIp;
        String details;
    }
}
