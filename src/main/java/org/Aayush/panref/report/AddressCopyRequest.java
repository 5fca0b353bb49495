package org.Aayush.panref.report;

import lombok.Builder;
import lombok.Value;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parameters of an address copy.
 */
@Value
@Builder
public class AddressCopyRequest {
    private static final Pattern IPV4 = Pattern.compile("(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})(?:/(\\d{1,2}))?");

    /** Existing address to copy. */
    String sourceAddress;
    /** Name of the new address object. */
    String newAddress;
    /** IPv4 address or CIDR of the new object. */
    String newIpNetmask;
    /** Reference handling, {@link CopyMode#ADD} when unset. */
    @Builder.Default
    CopyMode mode = CopyMode.ADD;

    /**
     * Checks that every field is present and the IP/netmask is well formed.
     *
     * @throws IllegalArgumentException describing the first problem found.
     */
    public void validate() {
        if (isBlank(sourceAddress)) {
            throw new IllegalArgumentException("source address name is required");
        }
        if (isBlank(newAddress)) {
            throw new IllegalArgumentException("new address name is required");
        }
        if (isBlank(newIpNetmask)) {
            throw new IllegalArgumentException("new IP/netmask is required");
        }
        if (!isIpNetmask(newIpNetmask.trim())) {
            throw new IllegalArgumentException("invalid IP/netmask format: " + newIpNetmask);
        }
        if (mode == null) {
            throw new IllegalArgumentException("copy mode is required");
        }
    }

    static boolean isIpNetmask(String value) {
        Matcher matcher = IPV4.matcher(value);
        if (!matcher.matches()) {
            return false;
        }
        for (int i = 1; i <= 4; i++) {
            if (Integer.parseInt(matcher.group(i)) > 255) {
                return false;
            }
        }
        return matcher.group(5) == null || Integer.parseInt(matcher.group(5)) <= 32;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
