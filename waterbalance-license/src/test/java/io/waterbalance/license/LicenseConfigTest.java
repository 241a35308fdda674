package io.waterbalance.license;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link LicenseConfig}.
 */
class LicenseConfigTest {

    private static Map<String, String> env(String... pairs) {
        Map<String, String> env = new HashMap<>();
        env.put("XDG_CONFIG_HOME", "/tmp/wb-config");
        for (int i = 0; i < pairs.length; i += 2) {
            env.put(pairs[i], pairs[i + 1]);
        }
        return env;
    }

    @Test
    @DisplayName("an empty environment yields the defaults")
    void fromEnvironment_defaults() {
        LicenseConfig config = LicenseConfig.fromEnvironment(env());

        assertEquals(Path.of("/tmp/wb-config", "waterbalance"), config.dataDir());
        assertNull(config.registryUrl());
        assertNull(config.webhookUrl());
        assertEquals(Duration.ofSeconds(10), config.timeout());
        assertEquals(Duration.ofDays(7), config.gracePeriod());
        assertEquals(2, config.matchThreshold());
        assertEquals(3, config.manualLimit());
        assertEquals("support@waterbalance.io", config.supportEmail());
        assertFalse(config.smtp().isConfigured());
        assertEquals(587, config.smtp().port());
    }

    @Test
    @DisplayName("variables override the defaults")
    void fromEnvironment_overrides() {
        LicenseConfig config = LicenseConfig.fromEnvironment(env(
            LicenseConfig.ENV_REGISTRY_URL, "https://registry.example/licenses",
            LicenseConfig.ENV_WEBHOOK_URL, "https://registry.example/hook",
            LicenseConfig.ENV_API_KEY, "secret",
            LicenseConfig.ENV_TIMEOUT_SECONDS, "4",
            LicenseConfig.ENV_GRACE_DAYS, "3",
            LicenseConfig.ENV_MATCH_THRESHOLD, "3",
            LicenseConfig.ENV_MANUAL_LIMIT, "5",
            LicenseConfig.ENV_SMTP_HOST, "smtp.example.com",
            LicenseConfig.ENV_SMTP_PORT, "465",
            LicenseConfig.ENV_SMTP_SSL, "1",
            LicenseConfig.ENV_SMTP_USER, "mailer",
            LicenseConfig.ENV_SMTP_FROM, "licensing@waterbalance.io",
            LicenseConfig.ENV_SUPPORT_EMAIL, "help@minesite.example"));

        assertEquals(URI.create("https://registry.example/licenses"), config.registryUrl());
        assertEquals(URI.create("https://registry.example/hook"), config.webhookUrl());
        assertEquals("secret", config.apiKey());
        assertEquals(Duration.ofSeconds(4), config.timeout());
        assertEquals(Duration.ofDays(3), config.gracePeriod());
        assertEquals(3, config.matchThreshold());
        assertEquals(5, config.manualLimit());
        assertTrue(config.smtp().isConfigured());
        assertTrue(config.smtp().ssl());
        assertTrue(config.smtp().requiresAuth());
        assertEquals(465, config.smtp().port());
        assertEquals("help@minesite.example", config.smtp().supportEmail());
    }

    @Test
    @DisplayName("the webhook defaults to the registry endpoint")
    void webhook_defaultsToRegistry() {
        LicenseConfig config = LicenseConfig.fromEnvironment(env(
            LicenseConfig.ENV_REGISTRY_URL, "https://registry.example/licenses"));

        assertEquals(config.registryUrl(), config.webhookUrl());
    }

    @Test
    @DisplayName("non-numeric values fall back to the default")
    void fromEnvironment_nonNumeric_default() {
        LicenseConfig config = LicenseConfig.fromEnvironment(env(LicenseConfig.ENV_GRACE_DAYS, "a week"));

        assertEquals(Duration.ofDays(7), config.gracePeriod());
    }

    @Test
    @DisplayName("without XDG_CONFIG_HOME the data directory is under the home directory")
    void dataDir_homeFallback() {
        Path dir = LicenseConfig.dataDirFrom(Map.of());

        assertEquals(Path.of(System.getProperty("user.home"), ".config", "waterbalance"), dir);
    }

    @Test
    @DisplayName("invalid settings are rejected")
    void build_invalid_throws() {
        assertThrows(IllegalArgumentException.class, () -> LicenseConfig.builder().build());
        assertThrows(IllegalArgumentException.class,
            () -> LicenseConfig.builder().dataDir(Path.of("x")).matchThreshold(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> LicenseConfig.builder().dataDir(Path.of("x")).manualLimit(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> LicenseConfig.builder().dataDir(Path.of("x")).timeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
            () -> LicenseConfig.fromEnvironment(env(LicenseConfig.ENV_REGISTRY_URL, "not a url")));
    }

    @Test
    @DisplayName("toString does not reveal the API key")
    void toString_hidesApiKey() {
        LicenseConfig config = LicenseConfig.builder().dataDir(Path.of("x")).apiKey("secret-value").build();

        assertFalse(config.toString().contains("secret-value"));
    }
}
