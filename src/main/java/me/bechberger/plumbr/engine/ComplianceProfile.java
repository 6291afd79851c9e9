package me.bechberger.plumbr.engine;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Named groupings of built-in pattern categories.
 * <p>
 * Which categories belong to which profile is part of the built-in pattern table
 * ({@code patterns/builtin.yaml}); this enum only names the profiles.
 */
public enum ComplianceProfile {
    /**
     * Protected health information identifiers
     */
    HIPAA("hipaa", "Health data identifiers (email, phone, SSN, IP addresses)"),

    /**
     * Payment card industry
     */
    PCI("pci", "Payment data (card numbers, IBANs) and authentication secrets"),

    /**
     * EU personal data
     */
    GDPR("gdpr", "Personal data (email, phone, IP addresses, IBANs)"),

    /**
     * Credentials and keys
     */
    SOC2("soc2", "Credentials, cloud keys and platform tokens"),

    /**
     * Every built-in category
     */
    ALL("all", "Every built-in pattern");

    private final String name;
    private final String description;

    ComplianceProfile(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Get profile by name (case-insensitive)
     *
     * @param name The profile name
     * @return The profile, or null if not found
     */
    public static ComplianceProfile fromName(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        for (ComplianceProfile profile : values()) {
            if (profile.name.equalsIgnoreCase(trimmed)) {
                return profile;
            }
        }
        return null;
    }

    /**
     * Comma separated list of all profile names, for error messages.
     */
    public static String availableNames() {
        return Arrays.stream(values()).map(ComplianceProfile::getName).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return name;
    }
}
