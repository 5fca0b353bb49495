package org.Aayush.panref.resolve;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.panref.classify.ConfigPatterns;
import org.Aayush.panref.classify.ContextClassifier;
import org.Aayush.panref.core.ScanContext;
import org.Aayush.panref.core.ScanStage;
import org.Aayush.panref.model.AddressGroupDescriptor;
import org.Aayush.panref.model.IndirectRuleContext;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds security rules that reference a target through one of its address groups.
 *
 * <p>Builds a reverse index from group name to every (group, owning target) pair
 * known at the time the stage runs, then re-scans rule-bearing lines. A rule
 * already recorded as direct for the owning target is skipped.</p>
 */
@Slf4j
public final class IndirectReferenceResolver implements ResolverStage {

    @Override
    public ScanStage stage() {
        return ScanStage.INDIRECT_RULES;
    }

    @Override
    public int resolve(ScanContext context) throws IOException {
        Map<String, List<GroupOwner>> ownersByGroup = reverseIndex(context);
        if (ownersByGroup.isEmpty()) {
            log.debug("no address groups known for targets, skipping indirect rule re-scan");
            return 0;
        }

        int[] added = {0};
        context.forEachLine(line -> added[0] += resolveLine(context, ownersByGroup, line));
        return added[0];
    }

    private static Map<String, List<GroupOwner>> reverseIndex(ScanContext context) {
        Map<String, List<GroupOwner>> ownersByGroup = new LinkedHashMap<>();
        for (String target : context.getTargets().names()) {
            for (AddressGroupDescriptor group : context.result(target).addressGroups()) {
                ownersByGroup.computeIfAbsent(group.name(), name -> new ArrayList<>())
                        .add(new GroupOwner(group, target));
            }
        }
        return ownersByGroup;
    }

    private static int resolveLine(ScanContext context, Map<String, List<GroupOwner>> ownersByGroup, String line) {
        if (!ConfigPatterns.isRuleBearing(line)) {
            return 0;
        }
        List<String> referenced = new ArrayList<>();
        for (String groupName : ownersByGroup.keySet()) {
            if (context.getAdmissionStrategy().admits(line, groupName)) {
                referenced.add(groupName);
            }
        }
        if (referenced.isEmpty()) {
            return 0;
        }
        String ruleName = context.getClassifier().securityRule(line);
        if (ruleName == null) {
            return 0;
        }
        String deviceGroup = context.getClassifier().deviceGroupOrUnknown(line);

        int added = 0;
        for (String groupName : referenced) {
            boolean inDestination = ContextClassifier.appearsAfter(line, ContextClassifier.DESTINATION, groupName);
            boolean inSource = ContextClassifier.appearsAfter(line, ContextClassifier.SOURCE, groupName);
            for (GroupOwner owner : ownersByGroup.get(groupName)) {
                IndirectRuleContext ruleContext =
                        new IndirectRuleContext(owner.group(), owner.target(), inDestination, inSource);
                if (context.result(owner.target()).putIndirectRule(ruleName, deviceGroup, ruleContext)) {
                    added++;
                }
            }
        }
        return added;
    }

    private record GroupOwner(AddressGroupDescriptor group, String target) {
    }
}
