package org.Aayush.panref.report;

import org.Aayush.panref.model.AddressGroupDescriptor;
import org.Aayush.panref.model.AddressResult;
import org.Aayush.panref.model.IndirectRuleContext;
import org.Aayush.panref.model.RedundantAddress;
import org.Aayush.panref.model.RuleContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the category-to-items view of one result record. Pure; no I/O.
 *
 * <p>Every category is present, empty categories map to empty lists.</p>
 */
public final class ReportAssembler {
    public static final String DEVICE_GROUP_LABEL = " (Device Group: ";

    /**
     * Formats one record.
     *
     * @param result result record of one target address.
     * @return unmodifiable map in {@link ReportCategory} order.
     */
    public Map<ReportCategory, List<String>> format(AddressResult result) {
        Objects.requireNonNull(result, "result");
        EnumMap<ReportCategory, List<String>> view = new EnumMap<>(ReportCategory.class);
        view.put(ReportCategory.DEVICE_GROUPS, List.copyOf(result.deviceGroups()));
        view.put(ReportCategory.DIRECT_SECURITY_RULES, directRules(result));
        view.put(ReportCategory.INDIRECT_SECURITY_RULES, indirectRules(result));
        view.put(ReportCategory.ADDRESS_GROUPS, addressGroups(result));
        view.put(ReportCategory.NAT_RULES, List.copyOf(result.natRules()));
        view.put(ReportCategory.SERVICE_GROUPS, List.copyOf(result.serviceGroups()));
        view.put(ReportCategory.REDUNDANT_ADDRESSES, redundantAddresses(result));
        return Collections.unmodifiableMap(view);
    }

    /**
     * Renders one rule item as {@code name (Device Group: dg, context)}.
     */
    public static String ruleItem(String ruleName, String deviceGroup, String context) {
        return ruleName + DEVICE_GROUP_LABEL + deviceGroup + ", " + context + ")";
    }

    /**
     * Renders one group item as {@code name (shared scope)} or {@code name (device-group: dg)}.
     */
    public static String groupItem(AddressGroupDescriptor group) {
        return group.isShared()
                ? group.name() + " (shared scope)"
                : group.name() + " (device-group: " + group.deviceGroup() + ")";
    }

    private static List<String> directRules(AddressResult result) {
        List<String> items = new ArrayList<>();
        for (Map.Entry<String, String> rule : result.directRules().entrySet()) {
            RuleContext context = result.directRuleContexts().getOrDefault(rule.getKey(), RuleContext.DIRECT_REFERENCE);
            items.add(ruleItem(rule.getKey(), rule.getValue(), context.description()));
        }
        return List.copyOf(items);
    }

    private static List<String> indirectRules(AddressResult result) {
        List<String> items = new ArrayList<>();
        for (Map.Entry<String, String> rule : result.indirectRules().entrySet()) {
            IndirectRuleContext context = result.indirectRuleContexts().get(rule.getKey());
            items.add(ruleItem(rule.getKey(), rule.getValue(), context == null ? "indirect reference" : context.describe()));
        }
        return List.copyOf(items);
    }

    private static List<String> addressGroups(AddressResult result) {
        List<String> items = new ArrayList<>();
        for (AddressGroupDescriptor group : result.addressGroups()) {
            items.add(groupItem(group));
        }
        return List.copyOf(items);
    }

    private static List<String> redundantAddresses(AddressResult result) {
        List<String> items = new ArrayList<>();
        for (RedundantAddress peer : result.redundantAddresses()) {
            items.add(peer.name() + " (IP/Netmask: " + peer.ipNetmask() + ", Scope: " + peer.deviceGroup() + ")");
        }
        return List.copyOf(items);
    }
}
