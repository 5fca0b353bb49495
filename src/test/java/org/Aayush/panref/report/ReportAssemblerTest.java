package org.Aayush.panref.report;

import org.Aayush.panref.model.AddressGroupDescriptor;
import org.Aayush.panref.model.AddressResult;
import org.Aayush.panref.model.IndirectRuleContext;
import org.Aayush.panref.model.RedundantAddress;
import org.Aayush.panref.model.RuleContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("ReportAssembler Tests")
class ReportAssemblerTest {
    private final ReportAssembler assembler = new ReportAssembler();

    @Test
    @DisplayName("Categories follow report order and render their items")
    void testFormat() {
        AddressResult result = new AddressResult("web1");
        result.addMatchingLine("set device-group DG1 security-rule R1 source web1");
        result.addDeviceGroup("DG1");
        result.putDirectRule("R1", "DG1", RuleContext.SOURCE_FIELD);
        AddressGroupDescriptor web = AddressGroupDescriptor.shared("WEB", "[ web1 ]");
        result.addAddressGroup(web);
        result.addAddressGroup(AddressGroupDescriptor.scoped("DG1", "APP", "[ web1 ]"));
        result.putIndirectRule("R9", "DG1", new IndirectRuleContext(web, "web1", false, true));
        result.addNatRule("NAT-1");
        result.addServiceGroup("SG1");
        result.addRedundantAddress(new RedundantAddress("web1-old", "10.0.0.1/32", "shared"));

        Map<ReportCategory, List<String>> view = assembler.format(result);

        assertEquals(List.of(ReportCategory.values()), List.copyOf(view.keySet()));
        assertEquals(List.of("DG1"), view.get(ReportCategory.DEVICE_GROUPS));
        assertEquals(List.of("R1 (Device Group: DG1, contains address in source)"),
                view.get(ReportCategory.DIRECT_SECURITY_RULES));
        assertEquals(List.of("R9 (Device Group: DG1, references shared address-group 'WEB' that contains web1 (in source))"),
                view.get(ReportCategory.INDIRECT_SECURITY_RULES));
        assertEquals(List.of("WEB (shared scope)", "APP (device-group: DG1)"),
                view.get(ReportCategory.ADDRESS_GROUPS));
        assertEquals(List.of("NAT-1"), view.get(ReportCategory.NAT_RULES));
        assertEquals(List.of("SG1"), view.get(ReportCategory.SERVICE_GROUPS));
        assertEquals(List.of("web1-old (IP/Netmask: 10.0.0.1/32, Scope: shared)"),
                view.get(ReportCategory.REDUNDANT_ADDRESSES));
    }

    @Test
    @DisplayName("View is read-only")
    void testReadOnly() {
        Map<ReportCategory, List<String>> view = assembler.format(new AddressResult("web1"));
        assertThrows(UnsupportedOperationException.class, () -> view.remove(ReportCategory.NAT_RULES));
        assertThrows(UnsupportedOperationException.class, () -> view.get(ReportCategory.NAT_RULES).add("x"));
    }
}
