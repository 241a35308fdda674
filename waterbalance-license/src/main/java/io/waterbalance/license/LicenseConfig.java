package io.waterbalance.license;

import io.waterbalance.license.hardware.HardwareFingerprint;
import io.waterbalance.license.hardware.HardwareFingerprinter;
import io.waterbalance.license.notify.SmtpSettings;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Configuration for Water Balance licensing.
 *
 * <p>Built from {@code WATERBALANCE_*} environment variables with
 * {@link #fromEnvironment()}, or programmatically with {@link #builder()}.
 * Instances are immutable.
 */
public final class LicenseConfig {

    private static final Logger LOG = Logger.getLogger(LicenseConfig.class.getName());

    public static final String ENV_REGISTRY_URL = "WATERBALANCE_LICENSE_REGISTRY_URL";
    public static final String ENV_WEBHOOK_URL = "WATERBALANCE_LICENSE_WEBHOOK_URL";
    public static final String ENV_API_KEY = "WATERBALANCE_LICENSE_API_KEY";
    public static final String ENV_TIMEOUT_SECONDS = "WATERBALANCE_LICENSE_TIMEOUT_SECONDS";
    public static final String ENV_GRACE_DAYS = "WATERBALANCE_LICENSE_GRACE_DAYS";
    public static final String ENV_MATCH_THRESHOLD = "WATERBALANCE_LICENSE_MATCH_THRESHOLD";
    public static final String ENV_MANUAL_LIMIT = "WATERBALANCE_LICENSE_MANUAL_LIMIT";
    public static final String ENV_IP_LOOKUP_URL = "WATERBALANCE_LICENSE_IP_LOOKUP_URL";

    public static final String ENV_SMTP_HOST = "WATERBALANCE_SMTP_HOST";
    public static final String ENV_SMTP_PORT = "WATERBALANCE_SMTP_PORT";
    public static final String ENV_SMTP_SSL = "WATERBALANCE_SMTP_SSL";
    public static final String ENV_SMTP_USER = "WATERBALANCE_SMTP_USER";
    public static final String ENV_SMTP_PASSWORD = "WATERBALANCE_SMTP_PASSWORD";
    public static final String ENV_SMTP_FROM = "WATERBALANCE_SMTP_FROM";
    public static final String ENV_SUPPORT_EMAIL = "WATERBALANCE_SUPPORT_EMAIL";

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_GRACE_DAYS = 7;
    public static final int DEFAULT_MANUAL_LIMIT = 3;
    public static final int DEFAULT_SMTP_PORT = 587;
    public static final String DEFAULT_SUPPORT_EMAIL = "support@waterbalance.io";

    private final Path dataDir;
    private final URI registryUrl;
    private final URI webhookUrl;
    private final String apiKey;
    private final Duration timeout;
    private final Duration gracePeriod;
    private final int matchThreshold;
    private final int manualLimit;
    private final URI ipLookupUrl;
    private final SmtpSettings smtp;
    private final String supportEmail;

    private LicenseConfig(Builder builder) {
        if (builder.dataDir == null) {
            throw new IllegalArgumentException("dataDir is required");
        }
        if (builder.matchThreshold < 1 || builder.matchThreshold > HardwareFingerprint.COMPONENT_COUNT) {
            throw new IllegalArgumentException("matchThreshold must be between 1 and "
                + HardwareFingerprint.COMPONENT_COUNT + ": " + builder.matchThreshold);
        }
        if (builder.manualLimit < 1) {
            throw new IllegalArgumentException("manualLimit must be positive: " + builder.manualLimit);
        }
        if (builder.gracePeriod.isNegative() || builder.timeout.isNegative() || builder.timeout.isZero()) {
            throw new IllegalArgumentException("gracePeriod cannot be negative and timeout must be positive");
        }
        this.dataDir = builder.dataDir;
        this.registryUrl = builder.registryUrl;
        this.webhookUrl = builder.webhookUrl != null ? builder.webhookUrl : builder.registryUrl;
        this.apiKey = builder.apiKey;
        this.timeout = builder.timeout;
        this.gracePeriod = builder.gracePeriod;
        this.matchThreshold = builder.matchThreshold;
        this.manualLimit = builder.manualLimit;
        this.ipLookupUrl = builder.ipLookupUrl;
        this.supportEmail = builder.supportEmail;
        this.smtp = builder.smtp != null ? builder.smtp
            : new SmtpSettings(null, DEFAULT_SMTP_PORT, false, null, null, null, builder.supportEmail);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read the configuration from the process environment.
     */
    public static LicenseConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Read the configuration from the given variables.
     */
    public static LicenseConfig fromEnvironment(Map<String, String> env) {
        String supportEmail = valueOr(env.get(ENV_SUPPORT_EMAIL), DEFAULT_SUPPORT_EMAIL);
        SmtpSettings smtp = new SmtpSettings(
            blankToNull(env.get(ENV_SMTP_HOST)),
            intValue(env, ENV_SMTP_PORT, DEFAULT_SMTP_PORT),
            isTrue(env.get(ENV_SMTP_SSL)),
            blankToNull(env.get(ENV_SMTP_USER)),
            env.get(ENV_SMTP_PASSWORD),
            blankToNull(env.get(ENV_SMTP_FROM)),
            supportEmail
        );

        return builder()
            .dataDir(dataDirFrom(env))
            .registryUrl(uriValue(env, ENV_REGISTRY_URL))
            .webhookUrl(uriValue(env, ENV_WEBHOOK_URL))
            .apiKey(blankToNull(env.get(ENV_API_KEY)))
            .timeout(Duration.ofSeconds(intValue(env, ENV_TIMEOUT_SECONDS, (int) DEFAULT_TIMEOUT.toSeconds())))
            .gracePeriod(Duration.ofDays(intValue(env, ENV_GRACE_DAYS, DEFAULT_GRACE_DAYS)))
            .matchThreshold(intValue(env, ENV_MATCH_THRESHOLD, HardwareFingerprinter.DEFAULT_THRESHOLD))
            .manualLimit(intValue(env, ENV_MANUAL_LIMIT, DEFAULT_MANUAL_LIMIT))
            .ipLookupUrl(uriValue(env, ENV_IP_LOOKUP_URL))
            .supportEmail(supportEmail)
            .smtp(smtp)
            .build();
    }

    /**
     * Data directory: {@code $XDG_CONFIG_HOME/waterbalance}, else {@code ~/.config/waterbalance}.
     */
    static Path dataDirFrom(Map<String, String> env) {
        String configHome = env.get("XDG_CONFIG_HOME");
        if (configHome != null && !configHome.isBlank()) {
            return Path.of(configHome, "waterbalance");
        }
        return Path.of(System.getProperty("user.home"), ".config", "waterbalance");
    }

    public Path dataDir() {
        return dataDir;
    }

    /**
     * Registry read endpoint, or null if not configured.
     */
    public URI registryUrl() {
        return registryUrl;
    }

    /**
     * Registry write endpoint; the read endpoint unless set separately.
     */
    public URI webhookUrl() {
        return webhookUrl;
    }

    public String apiKey() {
        return apiKey;
    }

    public Duration timeout() {
        return timeout;
    }

    public Duration gracePeriod() {
        return gracePeriod;
    }

    public int matchThreshold() {
        return matchThreshold;
    }

    public int manualLimit() {
        return manualLimit;
    }

    public URI ipLookupUrl() {
        return ipLookupUrl;
    }

    public SmtpSettings smtp() {
        return smtp;
    }

    public String supportEmail() {
        return supportEmail;
    }

    @Override
    public String toString() {
        return "LicenseConfig[dataDir=" + dataDir
            + ", registry=" + registryUrl
            + ", grace=" + gracePeriod.toDays() + "d"
            + ", threshold=" + matchThreshold
            + ", manualLimit=" + manualLimit
            + ", smtp=" + smtp + "]";
    }

    private static URI uriValue(Map<String, String> env, String name) {
        String value = blankToNull(env.get(name));
        if (value == null) {
            return null;
        }
        try {
            return URI.create(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(name + " is not a valid URL: " + value, e);
        }
    }

    private static int intValue(Map<String, String> env, String name, int defaultValue) {
        String value = blankToNull(env.get(name));
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            LOG.warning("Ignoring non-numeric " + name + "='" + value + "', using " + defaultValue);
            return defaultValue;
        }
    }

    private static boolean isTrue(String value) {
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    private static String valueOr(String value, String defaultValue) {
        String v = blankToNull(value);
        return v != null ? v : defaultValue;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    /**
     * Builder for {@link LicenseConfig}.
     */
    public static final class Builder {
        private Path dataDir;
        private URI registryUrl;
        private URI webhookUrl;
        private String apiKey;
        private Duration timeout = DEFAULT_TIMEOUT;
        private Duration gracePeriod = Duration.ofDays(DEFAULT_GRACE_DAYS);
        private int matchThreshold = HardwareFingerprinter.DEFAULT_THRESHOLD;
        private int manualLimit = DEFAULT_MANUAL_LIMIT;
        private URI ipLookupUrl;
        private SmtpSettings smtp;
        private String supportEmail = DEFAULT_SUPPORT_EMAIL;

        private Builder() {}

        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        public Builder registryUrl(URI registryUrl) {
            this.registryUrl = registryUrl;
            return this;
        }

        public Builder webhookUrl(URI webhookUrl) {
            this.webhookUrl = webhookUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder gracePeriod(Duration gracePeriod) {
            this.gracePeriod = gracePeriod;
            return this;
        }

        public Builder matchThreshold(int matchThreshold) {
            this.matchThreshold = matchThreshold;
            return this;
        }

        public Builder manualLimit(int manualLimit) {
            this.manualLimit = manualLimit;
            return this;
        }

        public Builder ipLookupUrl(URI ipLookupUrl) {
            this.ipLookupUrl = ipLookupUrl;
            return this;
        }

        public Builder smtp(SmtpSettings smtp) {
            this.smtp = smtp;
            return this;
        }

        public Builder supportEmail(String supportEmail) {
            this.supportEmail = supportEmail;
            return this;
        }

        public LicenseConfig build() {
            return new LicenseConfig(this);
        }
    }
}
