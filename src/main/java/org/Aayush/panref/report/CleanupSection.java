package org.Aayush.panref.report;

/**
 * Sections of a cleanup plan, in the order their commands must be applied.
 */
public enum CleanupSection {
    TARGET_CREATION("Target creation"),
    DEFINITIONS("Redundant definitions"),
    ADDRESS_GROUPS("Address groups"),
    SECURITY_RULES("Security rules"),
    NAT_RULES("NAT rules"),
    SERVICE_GROUPS("Service groups");

    private final String label;

    CleanupSection(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
