package org.Aayush.panref.classify;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Fixed catalogue of configuration line shapes recognized by {@link LineClassifier}.
 *
 * <p>Every pattern is applied with {@link java.util.regex.Matcher#find()}, so a shape
 * may appear anywhere on the line.</p>
 */
public final class ConfigPatterns {
    public static final String UNKNOWN_DEVICE_GROUP = "Unknown";
    public static final String SHARED_SCOPE = "shared";
    public static final String SHARED_PREFIX = "set shared";

    /** {@code set shared|device-group <dg> address <name> ip-netmask <cidr>}. */
    public static final Pattern ADDRESS_DEFINITION = Pattern.compile(
            "set\\s+(?:shared|device-group\\s+(\\S+))\\s+address\\s+(\\S+)\\s+ip-netmask\\s+([\\d.]+/\\d+)"
    );
    /** {@code set shared address-group <name> static <members>}. */
    public static final Pattern SHARED_ADDRESS_GROUP = Pattern.compile(
            "set\\s+shared\\s+address-group\\s+(\\S+)\\s+static\\s+(.+)"
    );
    /** {@code set device-group <dg> address-group <name> static <members>}. */
    public static final Pattern DEVICE_GROUP_ADDRESS_GROUP = Pattern.compile(
            "set\\s+device-group\\s+(\\S+)\\s+address-group\\s+(\\S+)\\s+static\\s+(.+)"
    );
    /** Device-group owner of an address definition line. */
    public static final Pattern DEFINITION_DEVICE_GROUP = Pattern.compile(
            "set\\s+device-group\\s+(\\S+)\\s+address"
    );
    public static final Pattern DEVICE_GROUP = Pattern.compile("device-group\\s+(\\S+)");
    public static final Pattern NAT_RULE = Pattern.compile("nat-rule\\s+(\\S+)");
    public static final Pattern SERVICE_GROUP = Pattern.compile("service-group\\s+(\\S+)");

    /**
     * Security-rule name patterns in lookup priority. Quoted forms precede their
     * unquoted counterparts so {@code "My Rule"} is never cut at the first space.
     */
    public static final List<Pattern> SECURITY_RULE_PATTERNS = List.of(
            Pattern.compile("security-rule\\s+\"([^\"]+)\""),
            Pattern.compile("security-rule\\s+(\\S+)"),
            Pattern.compile("security\\s+rules\\s+\"([^\"]+)\""),
            Pattern.compile("security\\s+rules\\s+(\\S+)")
    );

    /** Literal markers of rule-bearing lines considered by the indirect re-scan. */
    public static final List<String> SECURITY_RULE_MARKERS = List.of("security rules", "security-rule");

    private ConfigPatterns() {
    }

    /**
     * Returns true when the line carries one of the security-rule markers.
     */
    public static boolean isRuleBearing(String line) {
        for (String marker : SECURITY_RULE_MARKERS) {
            if (line.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
