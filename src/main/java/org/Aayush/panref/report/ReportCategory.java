package org.Aayush.panref.report;

/**
 * Categories of the formatted per-address view, in report order.
 */
public enum ReportCategory {
    DEVICE_GROUPS("Device Groups"),
    DIRECT_SECURITY_RULES("Direct Security Rules"),
    INDIRECT_SECURITY_RULES("Indirect Security Rules (via Address Groups)"),
    ADDRESS_GROUPS("Address Groups"),
    NAT_RULES("NAT Rules"),
    SERVICE_GROUPS("Service Groups"),
    REDUNDANT_ADDRESSES("Redundant Addresses");

    private final String label;

    ReportCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
