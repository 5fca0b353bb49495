package org.Aayush.panref.core;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.panref.classify.ContextClassifier;
import org.Aayush.panref.classify.LineFacts;
import org.Aayush.panref.model.AddressDefinition;
import org.Aayush.panref.model.AddressResult;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Single linear pass collecting address definitions and direct per-target facts.
 *
 * <p>Address definitions are indexed for every line. Rule, group, NAT, service
 * and device-group facts are merged only into targets the admission strategy
 * finds on the line.</p>
 */
@Slf4j
final class PrimaryScanner {

    /**
     * Runs the pass.
     *
     * @return number of lines admitted for at least one target.
     * @throws IOException when the source cannot be opened or read.
     */
    int scan(ScanContext context) throws IOException {
        int[] admittedLines = {0};
        context.forEachLine(line -> {
            if (scanLine(context, line)) {
                admittedLines[0]++;
            }
        });
        log.debug("primary scan of {} admitted {} lines, indexed {} ip-netmask values",
                context.getSource().describe(), admittedLines[0], context.getIpNetmaskIndex().valueCount());
        return admittedLines[0];
    }

    private boolean scanLine(ScanContext context, String line) {
        TargetCatalog targets = context.getTargets();

        AddressDefinition definition = context.getClassifier().addressDefinition(line);
        if (definition != null) {
            context.getIpNetmaskIndex().record(definition);
            if (targets.contains(definition.name())) {
                AddressResult result = context.result(definition.name());
                result.setIpNetmask(definition.ipNetmask());
                result.recordDefinitionScope(context.getClassifier().definitionScope(line));
            }
        }

        List<String> admitted = new ArrayList<>();
        for (int i = 0; i < targets.size(); i++) {
            String address = targets.name(i);
            if (context.getAdmissionStrategy().admits(line, address)) {
                admitted.add(address);
            }
        }
        if (admitted.isEmpty()) {
            return false;
        }

        LineFacts facts = context.getClassifier().classify(line);
        for (String address : admitted) {
            merge(context.result(address), line, address, facts);
        }
        return true;
    }

    private static void merge(AddressResult result, String line, String address, LineFacts facts) {
        result.addMatchingLine(line);
        if (facts.getDeviceGroup() != null) {
            result.addDeviceGroup(facts.getDeviceGroup());
        }
        if (facts.getSecurityRule() != null) {
            result.putDirectRule(
                    facts.getSecurityRule(),
                    facts.deviceGroupOrUnknown(),
                    ContextClassifier.classify(line, address)
            );
        }
        if (facts.getAddressGroup() != null) {
            result.addAddressGroup(facts.getAddressGroup());
        }
        if (facts.getNatRule() != null) {
            result.addNatRule(facts.getNatRule());
        }
        if (facts.getServiceGroup() != null) {
            result.addServiceGroup(facts.getServiceGroup());
        }
    }
}
