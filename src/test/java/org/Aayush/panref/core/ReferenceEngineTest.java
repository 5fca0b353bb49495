package org.Aayush.panref.core;

import org.Aayush.panref.model.AddressGroupDescriptor;
import org.Aayush.panref.model.AddressResult;
import org.Aayush.panref.model.RedundantAddress;
import org.Aayush.panref.model.RuleContext;
import org.Aayush.panref.report.ReportCategory;
import org.Aayush.panref.testutil.ConfigFixtures;
import org.Aayush.panref.traits.matching.AdmissionStrategyRegistry;
import org.Aayush.panref.traits.matching.MatchingRuntimeConfig;
import org.Aayush.panref.traits.matching.ResolverOrder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ReferenceEngine Tests")
class ReferenceEngineTest {

    private static final String[] WEB_NESTING = {
            "set shared address web1 ip-netmask 10.0.0.1/32",
            "set shared address-group WEB static [ web1 web2 ]",
            "set shared address-group FRONT static [ WEB ]"
    };

    private static final String[] ORDERING_GAP = {
            "set shared address-group WEB static [ web1 ]",
            "set shared address-group FRONT static [ WEB ]",
            "set device-group DG1 pre-rulebase security rules R-FRONT destination FRONT"
    };

    private static List<String> groupNames(AddressResult result) {
        return result.addressGroups().stream().map(AddressGroupDescriptor::name).toList();
    }

    @Nested
    @DisplayName("Primary scan")
    class PrimaryScanTests {

        @Test
        @DisplayName("Device-group rule classifies destination and source per target")
        void testDeviceGroupRuleContexts(@TempDir Path dir) throws IOException {
            Path config = ConfigFixtures.write(dir,
                    "set device-group DG1 security-rule \"R1\" destination address1 source address2");
            ReferenceEngine engine = ReferenceEngine.defaults();

            RunOutcome outcome = engine.run(config, List.of("address1", "address2"));

            assertEquals(StageStatus.SUCCEEDED, outcome.getStatus());
            AddressResult first = engine.resultRecord("address1");
            AddressResult second = engine.resultRecord("address2");
            assertEquals(Map.of("R1", "DG1"), first.directRules());
            assertEquals(RuleContext.DESTINATION_FIELD, first.directRuleContexts().get("R1"));
            assertEquals(RuleContext.SOURCE_FIELD, second.directRuleContexts().get("R1"));
            assertEquals(List.of("DG1"), List.copyOf(first.deviceGroups()));
            assertEquals(1, first.matchingLines().size());
        }

        @Test
        @DisplayName("NAT rules, service groups and ip-netmask are merged")
        void testNatServiceAndNetmask() {
            ReferenceEngine engine = ReferenceEngine.defaults();
            engine.run(ConfigFixtures.inMemory(
                    "set shared address web1 ip-netmask 10.0.0.1/32",
                    "",
                    "   set device-group DG1 nat-rule NAT-1 source web1   ",
                    "set shared service-group SG1 members web1"
            ), List.of("web1"));

            AddressResult result = engine.resultRecord("web1");
            assertEquals("10.0.0.1/32", result.ipNetmask());
            assertEquals(List.of("NAT-1"), List.copyOf(result.natRules()));
            assertEquals(List.of("SG1"), List.copyOf(result.serviceGroups()));
            assertEquals("set device-group DG1 nat-rule NAT-1 source web1", result.matchingLines().get(1));
            assertEquals(3, result.matchingLines().size());
        }

        @Test
        @DisplayName("Rule without device group is filed under Unknown")
        void testRuleWithoutDeviceGroup() {
            ReferenceEngine engine = ReferenceEngine.defaults();
            engine.run(ConfigFixtures.inMemory("set rulebase security rules LOCAL source web1"), List.of("web1"));

            assertEquals(Map.of("LOCAL", "Unknown"), engine.resultRecord("web1").directRules());
            assertEquals(RuleContext.SOURCE_FIELD, engine.resultRecord("web1").directRuleContexts().get("LOCAL"));
        }

        @Test
        @DisplayName("Substring admission over-matches while token boundary does not")
        void testAdmissionStrategies() {
            String[] lines = {
                    "set shared address web1 ip-netmask 10.0.0.1/32",
                    "set shared address web10 ip-netmask 10.0.0.10/32"
            };
            ReferenceEngine substring = ReferenceEngine.defaults();
            ReferenceEngine token = ReferenceEngine.builder()
                    .matchingRuntimeConfig(MatchingRuntimeConfig.builder()
                            .admissionStrategyId(AdmissionStrategyRegistry.STRATEGY_TOKEN_BOUNDARY)
                            .build())
                    .build();

            substring.run(ConfigFixtures.inMemory(lines), List.of("web1"));
            token.run(ConfigFixtures.inMemory(lines), List.of("web1"));

            assertEquals(2, substring.resultRecord("web1").matchingLines().size());
            assertEquals(1, token.resultRecord("web1").matchingLines().size());
            assertEquals("10.0.0.1/32", token.resultRecord("web1").ipNetmask());
        }

        @Test
        @DisplayName("Target with no matching lines gets an empty record with every category")
        void testTargetWithoutMatches() {
            ReferenceEngine engine = ReferenceEngine.defaults();
            RunOutcome outcome = engine.run(ConfigFixtures.inMemory(WEB_NESTING), List.of("ghost"));

            assertTrue(outcome.isSuccess());
            assertFalse(engine.resultRecord("ghost").hasMatches());
            Map<ReportCategory, List<String>> view = engine.format("ghost");
            assertEquals(ReportCategory.values().length, view.size());
            view.values().forEach(items -> assertTrue(items.isEmpty()));
        }
    }

    @Nested
    @DisplayName("Resolver stages")
    class ResolverTests {

        @Test
        @DisplayName("Nested group is attached one level up")
        void testNestedGroup() {
            ReferenceEngine engine = ReferenceEngine.defaults();
            engine.run(ConfigFixtures.inMemory(WEB_NESTING), List.of("web1"));

            assertEquals(List.of("WEB", "FRONT"), groupNames(engine.resultRecord("web1")));
        }

        @Test
        @DisplayName("Three-level chain stops after one level of indirection")
        void testThreeLevelChain() {
            ReferenceEngine engine = ReferenceEngine.defaults();
            engine.run(ConfigFixtures.inMemory(
                    "set shared address-group G3 static [ addrX ]",
                    "set shared address-group G2 static [ G3 ]",
                    "set shared address-group G1 static [ G2 ]"
            ), List.of("addrX"));

            assertEquals(List.of("G3", "G2"), groupNames(engine.resultRecord("addrX")));
        }

        @Test
        @DisplayName("Objects sharing an ip-netmask are flagged with their scope")
        void testRedundancy() {
            ReferenceEngine engine = ReferenceEngine.defaults();
            engine.run(ConfigFixtures.inMemory(
                    "set shared address address1 ip-netmask 10.0.0.1/32",
                    "set shared address address2 ip-netmask 10.0.0.1/32"
            ), List.of("address1"));

            assertEquals(List.of(new RedundantAddress("address2", "10.0.0.1/32", "shared")),
                    engine.resultRecord("address1").redundantAddresses());
        }

        @Test
        @DisplayName("Redundancy is symmetric when both objects are targets")
        void testSymmetricRedundancy() {
            ReferenceEngine engine = ReferenceEngine.defaults();
            engine.run(ConfigFixtures.inMemory(
                    "set shared address hostA ip-netmask 10.1.1.1/32",
                    "set device-group DG2 address hostB ip-netmask 10.1.1.1/32"
            ), List.of("hostA", "hostB"));

            assertEquals(List.of(new RedundantAddress("hostB", "10.1.1.1/32", "DG2")),
                    engine.resultRecord("hostA").redundantAddresses());
            assertEquals(List.of(new RedundantAddress("hostA", "10.1.1.1/32", "shared")),
                    engine.resultRecord("hostB").redundantAddresses());
        }

        @Test
        @DisplayName("Rule naming a target's group is recorded as indirect with explanation")
        void testIndirectRule() {
            ReferenceEngine engine = ReferenceEngine.defaults();
            engine.run(ConfigFixtures.inMemory(
                    "set shared address web1 ip-netmask 10.0.0.1/32",
                    "set shared address-group WEB static [ web1 ]",
                    "set device-group DG1 pre-rulebase security rules ALLOW-WEB destination WEB"
            ), List.of("web1"));

            AddressResult result = engine.resultRecord("web1");
            assertEquals(Map.of("ALLOW-WEB", "DG1"), result.indirectRules());
            assertTrue(result.directRules().isEmpty());
            assertEquals(
                    List.of("ALLOW-WEB (Device Group: DG1, references shared address-group 'WEB' that contains web1 (in destination))"),
                    engine.format("web1").get(ReportCategory.INDIRECT_SECURITY_RULES)
            );
        }

        @Test
        @DisplayName("Rule naming both target and group stays direct only")
        void testDirectWinsOverIndirect() {
            ReferenceEngine engine = ReferenceEngine.defaults();
            engine.run(ConfigFixtures.inMemory(
                    "set shared address-group WEB static [ web1 ]",
                    "set device-group DG1 pre-rulebase security rules R2 source web1 destination WEB"
            ), List.of("web1"));

            AddressResult result = engine.resultRecord("web1");
            assertEquals(RuleContext.SOURCE_FIELD, result.directRuleContexts().get("R2"));
            assertFalse(result.indirectRules().containsKey("R2"));
        }

        @Test
        @DisplayName("Compatible order misses rules naming a nested group")
        void testCompatibleOrderGap() {
            ReferenceEngine engine = ReferenceEngine.defaults();
            engine.run(ConfigFixtures.inMemory(ORDERING_GAP), List.of("web1"));

            AddressResult result = engine.resultRecord("web1");
            assertEquals(List.of("WEB", "FRONT"), groupNames(result));
            assertTrue(result.indirectRules().isEmpty());
        }

        @Test
        @DisplayName("Nested-first order finds rules naming a nested group")
        void testNestedFirstOrder() {
            ReferenceEngine engine = ReferenceEngine.builder()
                    .matchingRuntimeConfig(MatchingRuntimeConfig.builder()
                            .resolverOrder(ResolverOrder.NESTED_BEFORE_INDIRECT)
                            .build())
                    .build();
            RunOutcome outcome = engine.run(ConfigFixtures.inMemory(ORDERING_GAP), List.of("web1"));

            assertEquals(Map.of("R-FRONT", "DG1"), engine.resultRecord("web1").indirectRules());
            assertEquals(ScanStage.NESTED_GROUPS, outcome.getStages().get(2).stage());
            assertEquals(ScanStage.INDIRECT_RULES, outcome.getStages().get(3).stage());
        }
    }

    @Nested
    @DisplayName("Run outcomes")
    class OutcomeTests {

        @Test
        @DisplayName("Two runs over the same input produce equal records")
        void testDeterminism() {
            ReferenceEngine engine = ReferenceEngine.defaults();
            engine.run(ConfigFixtures.inMemory(WEB_NESTING), List.of("web1", "web2"));
            List<AddressResult> first = engine.resultRecords();
            engine.run(ConfigFixtures.inMemory(WEB_NESTING), List.of("web1", "web2"));

            assertEquals(first, engine.resultRecords());
        }

        @Test
        @DisplayName("Missing input is fatal and exposes no results")
        void testMissingInput(@TempDir Path dir) {
            ReferenceEngine engine = ReferenceEngine.defaults();
            engine.run(ConfigFixtures.inMemory(WEB_NESTING), List.of("web1"));

            RunOutcome outcome = engine.run(dir.resolve("missing.txt"), List.of("web1"));

            assertEquals(StageStatus.FATAL, outcome.getStatus());
            assertEquals(ReferenceEngine.REASON_INPUT_NOT_FOUND, outcome.getReasonCode());
            assertFalse(outcome.isSuccess());
            assertTrue(engine.resultRecords().isEmpty());
            assertFalse(engine.resultRecord("web1").hasMatches());
            assertNull(outcome.stage(ScanStage.REDUNDANCY));
        }

        @Test
        @DisplayName("Read failure during the primary scan is fatal")
        void testUnreadableInput() {
            RunOutcome outcome = ReferenceEngine.defaults().run(ConfigFixtures.unreadable(), List.of("web1"));

            assertEquals(StageStatus.FATAL, outcome.getStatus());
            assertEquals(ReferenceEngine.REASON_INPUT_READ_ERROR, outcome.getReasonCode());
            assertEquals(StageStatus.FATAL, outcome.stage(ScanStage.PRIMARY_SCAN).status());
        }

        @Test
        @DisplayName("Resolver re-scan failure degrades the run and keeps primary facts")
        void testResolverFailureDegrades() {
            ConfigFixtures.CountingSource source = ConfigFixtures.failingAfter(1, WEB_NESTING);
            ReferenceEngine engine = ReferenceEngine.defaults();

            RunOutcome outcome = engine.run(source, List.of("web1"));

            assertEquals(StageStatus.DEGRADED, outcome.getStatus());
            assertTrue(outcome.isSuccess());
            assertEquals(StageStatus.SUCCEEDED, outcome.stage(ScanStage.REDUNDANCY).status());
            assertEquals(StageStatus.DEGRADED, outcome.stage(ScanStage.INDIRECT_RULES).status());
            assertEquals(ReferenceEngine.REASON_RESOLVER_FAILED, outcome.stage(ScanStage.NESTED_GROUPS).reasonCode());
            assertEquals(List.of("WEB"), groupNames(engine.resultRecord("web1")));
            assertEquals(3, source.opens());
        }

        @Test
        @DisplayName("Empty target list is a fatal outcome")
        void testEmptyTargets() {
            RunOutcome outcome = ReferenceEngine.defaults().run(ConfigFixtures.inMemory(WEB_NESTING), List.of());

            assertEquals(StageStatus.FATAL, outcome.getStatus());
            assertEquals(ReferenceEngine.REASON_TARGETS_REQUIRED, outcome.getReasonCode());
            assertTrue(outcome.getStages().isEmpty());
        }

        @Test
        @DisplayName("Stages run once each in compatible order")
        void testStageOrder() {
            RunOutcome outcome = ReferenceEngine.defaults().run(ConfigFixtures.inMemory(WEB_NESTING), List.of("web1"));

            assertEquals(
                    List.of(ScanStage.PRIMARY_SCAN, ScanStage.REDUNDANCY, ScanStage.INDIRECT_RULES, ScanStage.NESTED_GROUPS),
                    outcome.getStages().stream().map(StageOutcome::stage).toList()
            );
            assertEquals(List.of("web1"), outcome.getAddresses());
        }

        @Test
        @DisplayName("Records returned after a run cannot be changed by callers")
        void testRecordsAreReadOnly() {
            ReferenceEngine engine = ReferenceEngine.defaults();
            engine.run(ConfigFixtures.inMemory(WEB_NESTING), List.of("web1"));
            AddressResult record = engine.resultRecord("web1");

            assertTrue(record.isSealed());
            assertThrows(UnsupportedOperationException.class, () -> record.addMatchingLine("set shared injected web1"));
            assertThrows(UnsupportedOperationException.class, () -> record.addNatRule("FAKE-NAT"));
            assertThrows(UnsupportedOperationException.class,
                    () -> record.putDirectRule("FAKE", "DG1", RuleContext.DIRECT_REFERENCE));
            assertThrows(UnsupportedOperationException.class,
                    () -> record.addRedundantAddress(new RedundantAddress("web9", "10.0.0.1/32", "shared")));
            assertThrows(UnsupportedOperationException.class,
                    () -> engine.resultRecord("ghost").addDeviceGroup("DG1"));

            assertEquals(2, engine.resultRecord("web1").matchingLines().size());
            assertTrue(engine.format("web1").get(ReportCategory.NAT_RULES).isEmpty());
            assertTrue(engine.format("web1").get(ReportCategory.DIRECT_SECURITY_RULES).isEmpty());
        }

        @Test
        @DisplayName("Definition scope follows the first definition line")
        void testDefinitionScope() {
            ReferenceEngine engine = ReferenceEngine.defaults();
            engine.run(ConfigFixtures.inMemory(
                    "set device-group DG3 address db1 ip-netmask 10.3.0.1/32",
                    "set shared address db1 ip-netmask 10.3.0.1/32"
            ), List.of("db1", "db2"));

            assertEquals("DG3", engine.resultRecord("db1").definitionScope());
            assertNull(engine.resultRecord("db2").definitionScope());
        }

        @Test
        @DisplayName("Unknown strategy id fails engine construction")
        void testUnknownStrategy() {
            ReferenceEngineException ex = assertThrows(ReferenceEngineException.class, () -> ReferenceEngine.builder()
                    .matchingRuntimeConfig(MatchingRuntimeConfig.builder().admissionStrategyId("FUZZY").build())
                    .build());
            assertEquals(ReferenceEngine.REASON_UNKNOWN_MATCHING_STRATEGY, ex.getReasonCode());
        }
    }
}
