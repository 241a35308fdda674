package io.waterbalance.license.notify;

/**
 * SMTP transport for owner alerts.
 *
 * @param host server host name
 * @param port server port (465 for implicit TLS, 587 for STARTTLS)
 * @param ssl implicit TLS on connect; otherwise STARTTLS is required
 * @param username login user (null = no authentication)
 * @param password login password
 * @param from sender address
 * @param supportEmail contact the alert tells the owner to write to
 */
public record SmtpSettings(
    String host,
    int port,
    boolean ssl,
    String username,
    String password,
    String from,
    String supportEmail
) {

    public boolean isConfigured() {
        return host != null && !host.isBlank() && from != null && !from.isBlank();
    }

    public boolean requiresAuth() {
        return username != null && !username.isBlank();
    }

    @Override
    public String toString() {
        return "SmtpSettings[" + host + ":" + port + ", ssl=" + ssl + ", user=" + username + "]";
    }
}
