package org.Aayush.panref.classify;

import org.Aayush.panref.model.AddressDefinition;
import org.Aayush.panref.model.AddressGroupDescriptor;
import org.Aayush.panref.model.GroupScope;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless classifier mapping one trimmed configuration line to its typed facts.
 *
 * <p>Shapes are matched independently, so one line may yield several facts.</p>
 */
public final class LineClassifier {

    /**
     * Classifies one line.
     *
     * @param line trimmed, non-empty configuration line.
     * @return extracted facts (possibly empty).
     */
    public LineFacts classify(String line) {
        Objects.requireNonNull(line, "line");
        return LineFacts.builder()
                .addressDefinition(addressDefinition(line))
                .addressGroup(addressGroup(line))
                .securityRule(securityRule(line))
                .natRule(firstGroup(ConfigPatterns.NAT_RULE, line))
                .serviceGroup(firstGroup(ConfigPatterns.SERVICE_GROUP, line))
                .deviceGroup(firstGroup(ConfigPatterns.DEVICE_GROUP, line))
                .build();
    }

    /**
     * Extracts an {@code address ... ip-netmask ...} definition, or null.
     */
    public AddressDefinition addressDefinition(String line) {
        Matcher matcher = ConfigPatterns.ADDRESS_DEFINITION.matcher(line);
        if (!matcher.find()) {
            return null;
        }
        String deviceGroup = matcher.group(1);
        return new AddressDefinition(
                matcher.group(2),
                matcher.group(3),
                deviceGroup == null ? GroupScope.SHARED : GroupScope.DEVICE_GROUP,
                deviceGroup,
                line
        );
    }

    /**
     * Extracts a shared or device-group address-group definition, or null.
     * The shared shape is tried first.
     */
    public AddressGroupDescriptor addressGroup(String line) {
        Matcher shared = ConfigPatterns.SHARED_ADDRESS_GROUP.matcher(line);
        if (shared.find()) {
            return AddressGroupDescriptor.shared(shared.group(1), shared.group(2));
        }
        Matcher scoped = ConfigPatterns.DEVICE_GROUP_ADDRESS_GROUP.matcher(line);
        if (scoped.find()) {
            return AddressGroupDescriptor.scoped(scoped.group(1), scoped.group(2), scoped.group(3));
        }
        return null;
    }

    /**
     * Extracts the security rule name using the quoted-first pattern priority, or null.
     */
    public String securityRule(String line) {
        for (Pattern pattern : ConfigPatterns.SECURITY_RULE_PATTERNS) {
            Matcher matcher = pattern.matcher(line);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }

    /**
     * Returns the device group named on the line, or {@code Unknown}.
     */
    public String deviceGroupOrUnknown(String line) {
        String deviceGroup = firstGroup(ConfigPatterns.DEVICE_GROUP, line);
        return deviceGroup == null ? ConfigPatterns.UNKNOWN_DEVICE_GROUP : deviceGroup;
    }

    /**
     * Derives the scope label of an address definition line: {@code shared}, the
     * owning device group, or {@code Unknown}.
     */
    public String definitionScope(String definitionLine) {
        if (definitionLine.startsWith(ConfigPatterns.SHARED_PREFIX)) {
            return ConfigPatterns.SHARED_SCOPE;
        }
        String deviceGroup = firstGroup(ConfigPatterns.DEFINITION_DEVICE_GROUP, definitionLine);
        return deviceGroup == null ? ConfigPatterns.UNKNOWN_DEVICE_GROUP : deviceGroup;
    }

    private static String firstGroup(Pattern pattern, String line) {
        Matcher matcher = pattern.matcher(line);
        return matcher.find() ? matcher.group(1) : null;
    }
}
