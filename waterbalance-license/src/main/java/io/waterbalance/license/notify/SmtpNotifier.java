package io.waterbalance.license.notify;

import io.waterbalance.license.hardware.HardwareFingerprint;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;

import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/**
 * Sends owner alerts over SMTP with Jakarta Mail.
 *
 * <p>Delivery runs on a single daemon thread, so a slow mail server never
 * holds up a transfer.
 */
public class SmtpNotifier implements Notifier, AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SmtpNotifier.class.getName());

    private static final String TIMEOUT_MILLIS = "10000";
    private static final DateTimeFormatter TIME_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final SmtpSettings settings;
    private final Session session;
    private final ExecutorService executor;

    public SmtpNotifier(SmtpSettings settings) {
        if (!settings.isConfigured()) {
            throw new IllegalArgumentException("SMTP host and sender address are required: " + settings);
        }
        this.settings = settings;
        this.session = Session.getInstance(sessionProperties(settings));
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "waterbalance-owner-alerts");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<Void> notifyOwner(OwnerAlert alert) {
        return CompletableFuture.runAsync(() -> send(alert), executor);
    }

    @Override
    public String getName() {
        return "SMTP " + settings.host() + ":" + settings.port();
    }

    @Override
    public void close() {
        executor.shutdown();
    }

    private void send(OwnerAlert alert) {
        try {
            MimeMessage message = composeMessage(alert);
            if (settings.requiresAuth()) {
                Transport.send(message, settings.username(), settings.password());
            } else {
                Transport.send(message);
            }
            LOG.info("Owner alert " + alert.kind() + " sent to " + alert.recipientEmail());
        } catch (MessagingException e) {
            throw new NotificationException("Failed to send owner alert to " + alert.recipientEmail(), e);
        }
    }

    MimeMessage composeMessage(OwnerAlert alert) throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(settings.from()));
        message.setRecipient(Message.RecipientType.TO, new InternetAddress(alert.recipientEmail()));
        message.setSubject(subject(alert), StandardCharsets.UTF_8.name());
        message.setText(body(alert), StandardCharsets.UTF_8.name());
        message.setSentDate(Date.from(alert.timestamp()));
        return message;
    }

    static String subject(OwnerAlert alert) {
        return alert.kind() == OwnerAlert.Kind.UNAUTHORIZED_ATTEMPT
            ? "Security alert: blocked license transfer attempt"
            : "License transfer notification";
    }

    String body(OwnerAlert alert) {
        HardwareFingerprint hw = alert.newFingerprint() != null ? alert.newFingerprint() : HardwareFingerprint.unbound();
        String details = String.format("""
            Transfer details:
            - License: %s
            - New CPU id: %s
            - New board id: %s
            - Network adapter: %s
            - Time: %s
            - Source address: %s
            """,
            alert.maskedKey(),
            HardwareFingerprint.abbreviate(hw.cpu()),
            HardwareFingerprint.abbreviate(hw.board()),
            HardwareFingerprint.abbreviate(hw.network()),
            TIME_FORMAT.format(alert.timestamp()),
            alert.sourceIp() != null ? alert.sourceIp() : "unknown");

        if (alert.kind() == OwnerAlert.Kind.UNAUTHORIZED_ATTEMPT) {
            return String.format("""
                Hello %s,

                Someone tried to move your Water Balance license to another machine,
                but could not confirm the email address registered to the license.
                The transfer was blocked.

                %s
                If this was you, repeat the transfer using your registered address: %s

                If this was not you, your license is safe. Please report the attempt to %s.

                Water Balance Support
                """, alert.recipientName(), details, alert.recipientEmail(), settings.supportEmail());
        }
        return String.format("""
            Hello %s,

            Your Water Balance license has been transferred to a new machine.

            %s
            If this was you, no action is needed.

            If this was NOT you, contact %s immediately so the transfer can be reversed.

            Water Balance Support
            """, alert.recipientName(), details, settings.supportEmail());
    }

    private static Properties sessionProperties(SmtpSettings settings) {
        Properties props = new Properties();
        props.put("mail.smtp.host", settings.host());
        props.put("mail.smtp.port", String.valueOf(settings.port()));
        props.put("mail.smtp.auth", String.valueOf(settings.requiresAuth()));
        props.put("mail.smtp.connectiontimeout", TIMEOUT_MILLIS);
        props.put("mail.smtp.timeout", TIMEOUT_MILLIS);
        props.put("mail.smtp.writetimeout", TIMEOUT_MILLIS);
        if (settings.ssl()) {
            props.put("mail.smtp.ssl.enable", "true");
        } else {
            props.put("mail.smtp.starttls.enable", "true");
            props.put("mail.smtp.starttls.required", "true");
        }
        return props;
    }
}
