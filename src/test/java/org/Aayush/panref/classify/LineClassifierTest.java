package org.Aayush.panref.classify;

import org.Aayush.panref.model.AddressDefinition;
import org.Aayush.panref.model.AddressGroupDescriptor;
import org.Aayush.panref.model.GroupScope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("LineClassifier Tests")
class LineClassifierTest {
    private final LineClassifier classifier = new LineClassifier();

    @Test
    @DisplayName("Shared address definition yields name, cidr and shared scope")
    void testSharedAddressDefinition() {
        AddressDefinition definition =
                classifier.addressDefinition("set shared address web1 ip-netmask 10.1.1.10/32");

        assertEquals("web1", definition.name());
        assertEquals("10.1.1.10/32", definition.ipNetmask());
        assertEquals(GroupScope.SHARED, definition.scope());
        assertNull(definition.deviceGroup());
    }

    @Test
    @DisplayName("Device-group address definition carries its device group")
    void testScopedAddressDefinition() {
        AddressDefinition definition =
                classifier.addressDefinition("set device-group DG-EDGE address db1 ip-netmask 10.2.0.0/24");

        assertEquals("db1", definition.name());
        assertEquals("10.2.0.0/24", definition.ipNetmask());
        assertEquals(GroupScope.DEVICE_GROUP, definition.scope());
        assertEquals("DG-EDGE", definition.deviceGroup());
    }

    @Test
    @DisplayName("Non ip-netmask address definitions are not address facts")
    void testFqdnAddressIgnored() {
        assertNull(classifier.addressDefinition("set shared address web1 fqdn web1.example.com"));
        assertNull(classifier.addressDefinition("set shared address-group WEB static [ web1 ]"));
    }

    @Test
    @DisplayName("Shared and scoped address-group definitions are recognized")
    void testAddressGroups() {
        AddressGroupDescriptor shared = classifier.addressGroup("set shared address-group WEB static [ web1 web2 ]");
        assertEquals(AddressGroupDescriptor.shared("WEB", "[ web1 web2 ]"), shared);

        AddressGroupDescriptor scoped =
                classifier.addressGroup("set device-group DG1 address-group APP static [ app1 ]");
        assertEquals(AddressGroupDescriptor.scoped("DG1", "APP", "[ app1 ]"), scoped);
    }

    @Test
    @DisplayName("Quoted security rule names win over the unquoted pattern")
    void testQuotedRuleName() {
        assertEquals("Allow Web", classifier.securityRule("set device-group DG1 security-rule \"Allow Web\" source any"));
        assertEquals("R7", classifier.securityRule("set device-group DG1 security-rule R7 destination web1"));
        assertEquals("Out Bound", classifier.securityRule("set rulebase security rules \"Out Bound\" to untrust"));
        assertEquals("R9", classifier.securityRule("set rulebase security rules R9 from trust"));
        assertNull(classifier.securityRule("set shared address web1 ip-netmask 10.0.0.1/32"));
    }

    @Test
    @DisplayName("One line can yield several facts at once")
    void testMultipleFacts() {
        LineFacts facts = classifier.classify(
                "set device-group DG1 pre-rulebase nat-rule NAT-1 service-group SG-WEB security-rule R1 destination web1");

        assertEquals("DG1", facts.getDeviceGroup());
        assertEquals("NAT-1", facts.getNatRule());
        assertEquals("SG-WEB", facts.getServiceGroup());
        assertEquals("R1", facts.getSecurityRule());
        assertEquals(EnumSet.of(
                FactType.DEVICE_GROUP_SCOPE,
                FactType.NAT_RULE_REFERENCE,
                FactType.SERVICE_GROUP_REFERENCE,
                FactType.SECURITY_RULE_REFERENCE
        ), facts.types());
    }

    @Test
    @DisplayName("Lines without a device group attribute facts to Unknown")
    void testUnknownDeviceGroup() {
        LineFacts facts = classifier.classify("set rulebase security rules R1 destination web1");
        assertNull(facts.getDeviceGroup());
        assertEquals(ConfigPatterns.UNKNOWN_DEVICE_GROUP, facts.deviceGroupOrUnknown());
        assertEquals(ConfigPatterns.UNKNOWN_DEVICE_GROUP, classifier.deviceGroupOrUnknown("set rulebase security rules R1"));
    }

    @Test
    @DisplayName("Unrelated lines yield no facts")
    void testNoFacts() {
        assertTrue(classifier.classify("set deviceconfig system hostname fw01").isEmpty());
    }

    @Test
    @DisplayName("Definition scope comes from the shared prefix or the owning device group")
    void testDefinitionScope() {
        assertEquals("shared", classifier.definitionScope("set shared address a1 ip-netmask 10.0.0.1/32"));
        assertEquals("DG2", classifier.definitionScope("set device-group DG2 address a1 ip-netmask 10.0.0.1/32"));
        assertEquals("Unknown", classifier.definitionScope("address a1 ip-netmask 10.0.0.1/32"));
    }
}
