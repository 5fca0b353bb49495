package org.Aayush.panref.classify;

/**
 * Fact kinds a single configuration line can encode.
 */
public enum FactType {
    ADDRESS_DEFINITION,
    ADDRESS_GROUP_DEFINITION,
    SECURITY_RULE_REFERENCE,
    NAT_RULE_REFERENCE,
    SERVICE_GROUP_REFERENCE,
    DEVICE_GROUP_SCOPE
}
