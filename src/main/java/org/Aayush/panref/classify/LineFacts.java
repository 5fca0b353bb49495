package org.Aayush.panref.classify;

import lombok.Builder;
import lombok.Value;
import org.Aayush.panref.model.AddressDefinition;
import org.Aayush.panref.model.AddressGroupDescriptor;

import java.util.EnumSet;
import java.util.Set;

/**
 * Typed facts extracted from one configuration line. Absent facts are null.
 */
@Value
@Builder
public class LineFacts {
    /** Address definition carried by the line. */
    AddressDefinition addressDefinition;
    /** Address-group definition carried by the line. */
    AddressGroupDescriptor addressGroup;
    /** Security rule name referenced by the line. */
    String securityRule;
    /** NAT rule name referenced by the line. */
    String natRule;
    /** Service group name referenced by the line. */
    String serviceGroup;
    /** Device group named anywhere on the line. */
    String deviceGroup;

    /**
     * Returns the kinds of facts present on the line.
     */
    public Set<FactType> types() {
        EnumSet<FactType> types = EnumSet.noneOf(FactType.class);
        if (addressDefinition != null) {
            types.add(FactType.ADDRESS_DEFINITION);
        }
        if (addressGroup != null) {
            types.add(FactType.ADDRESS_GROUP_DEFINITION);
        }
        if (securityRule != null) {
            types.add(FactType.SECURITY_RULE_REFERENCE);
        }
        if (natRule != null) {
            types.add(FactType.NAT_RULE_REFERENCE);
        }
        if (serviceGroup != null) {
            types.add(FactType.SERVICE_GROUP_REFERENCE);
        }
        if (deviceGroup != null) {
            types.add(FactType.DEVICE_GROUP_SCOPE);
        }
        return types;
    }

    public boolean isEmpty() {
        return types().isEmpty();
    }

    /**
     * Device group attributed to other facts on this line, {@code Unknown} when absent.
     */
    public String deviceGroupOrUnknown() {
        return deviceGroup == null ? ConfigPatterns.UNKNOWN_DEVICE_GROUP : deviceGroup;
    }
}
