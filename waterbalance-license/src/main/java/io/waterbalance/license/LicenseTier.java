package io.waterbalance.license;

import java.time.Duration;
import java.util.Locale;

/**
 * License tiers and their background revalidation cadence.
 *
 * <p>Tiers:
 * <ul>
 *   <li>Trial - checked hourly</li>
 *   <li>Standard - checked daily</li>
 *   <li>Premium - checked weekly</li>
 * </ul>
 */
public enum LicenseTier {

    TRIAL("Trial", Duration.ofHours(1)),

    STANDARD("Standard", Duration.ofHours(24)),

    PREMIUM("Premium", Duration.ofHours(168));

    private final String displayName;
    private final Duration checkInterval;

    LicenseTier(String displayName, Duration checkInterval) {
        this.displayName = displayName;
        this.checkInterval = checkInterval;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * How often the background task revalidates a license of this tier.
     */
    public Duration getCheckInterval() {
        return checkInterval;
    }

    /**
     * Parse a registry tier column using keyword matching.
     *
     * @param tierName the tier value from the registry (may be null)
     * @return the matching tier, or STANDARD if no match
     */
    public static LicenseTier fromRegistry(String tierName) {
        if (tierName == null) {
            return STANDARD;
        }

        String name = tierName.toLowerCase(Locale.ROOT);

        if (name.contains("trial")) {
            return TRIAL;
        }
        if (name.contains("premium") || name.contains("enterprise")) {
            return PREMIUM;
        }
        return STANDARD;
    }

    /**
     * Lowercase wire form, as written to the registry.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
