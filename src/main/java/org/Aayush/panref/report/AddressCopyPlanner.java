package org.Aayush.panref.report;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.panref.classify.MemberListParser;
import org.Aayush.panref.model.AddressGroupDescriptor;
import org.Aayush.panref.model.AddressResult;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Plans a new address object with another IP that inherits an existing address's references.
 *
 * <p>Only direct references are copied: groups listing the source as a member and
 * security rules naming it in their source or destination field. Groups that reach
 * the source through a nested group already reach the copy once it joins the inner
 * group. NAT rules are listed as review notes.</p>
 */
@Slf4j
public final class AddressCopyPlanner {

    /**
     * Builds the copy plan.
     *
     * @param source sealed result record of the source address.
     * @param request validated copy parameters.
     * @return ordered copy plan.
     * @throws IllegalArgumentException when the request is malformed or the source was never defined.
     */
    public AddressCopyPlan plan(AddressResult source, AddressCopyRequest request) {
        Objects.requireNonNull(request, "request").validate();
        String sourceName = request.getSourceAddress().trim();
        if (source == null || !source.address().equals(sourceName) || source.ipNetmask() == null) {
            throw new IllegalArgumentException("source address '" + sourceName + "' not found in configuration");
        }
        String newName = request.getNewAddress().trim();
        CopyMode mode = request.getMode();
        String scopePath = scopePath(source.definitionScope());

        AddressCopyPlan.AddressCopyPlanBuilder plan = AddressCopyPlan.builder()
                .sourceAddress(sourceName)
                .newAddress(newName)
                .scopePath(scopePath)
                .mode(mode)
                .createCommand("set " + scopePath + " address " + newName + " ip-netmask " + request.getNewIpNetmask().trim());

        Set<String> groupKeys = new LinkedHashSet<>();
        for (AddressGroupDescriptor group : source.addressGroups()) {
            if (!MemberListParser.parse(group.definition()).contains(sourceName)
                    || !groupKeys.add(group.scopePath() + "|" + group.name())) {
                continue;
            }
            plan.updateCommand("set " + group.scopePath() + " address-group " + group.name() + " static " + newName);
            if (mode == CopyMode.REPLACE) {
                plan.updateCommand("delete " + group.scopePath() + " address-group " + group.name() + " static " + sourceName);
            }
        }

        int rules = 0;
        for (Map.Entry<String, String> rule : source.directRules().entrySet()) {
            String field = CleanupPlanner.fieldOf(source.directRuleContexts().get(rule.getKey()));
            if (field == null) {
                continue;
            }
            rules++;
            String prefix = scopePath(rule.getValue()) + " rulebase security rules " + CleanupPlanner.quoted(rule.getKey()) + " " + field;
            plan.updateCommand("set " + prefix + " " + newName);
            if (mode == CopyMode.REPLACE) {
                plan.updateCommand("delete " + prefix + " " + sourceName);
            }
        }

        for (String natRule : source.natRules()) {
            plan.reviewNote("# NAT rule " + natRule + " references " + sourceName + " - add " + newName + " manually");
        }

        AddressCopyPlan built = plan
                .groupsToUpdate(groupKeys.size())
                .securityRulesToUpdate(rules)
                .natRulesToUpdate(source.natRules().size())
                .build();
        log.debug("copy plan {} -> {}: {} commands ({})", sourceName, newName, built.totalCommands(), mode);
        return built;
    }

    /**
     * Returns the conventional copy file name.
     */
    public static String copyFileName(String sourceAddress, String newAddress) {
        return "copy_" + sourceAddress.trim() + "_to_" + newAddress.trim() + "_commands.txt";
    }

    /**
     * Writes {@code plan} into {@code directory}.
     *
     * @return path of the written file.
     */
    public Path writeCommandFile(Path directory, AddressCopyPlan plan) throws IOException {
        Path file = Objects.requireNonNull(directory, "directory")
                .resolve(copyFileName(plan.getSourceAddress(), plan.getNewAddress()));
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write("# CLI commands to copy '" + plan.getSourceAddress() + "' to '" + plan.getNewAddress()
                    + "' (" + plan.getMode().name().toLowerCase(Locale.ROOT) + " mode)\n");
            out.write("# Groups: " + plan.getGroupsToUpdate()
                    + ", security rules: " + plan.getSecurityRulesToUpdate()
                    + ", NAT rules: " + plan.getNatRulesToUpdate() + "\n");
            out.write("# Total commands: " + plan.totalCommands() + "\n\n");
            for (String command : plan.getCreateCommands()) {
                out.write(command + "\n");
            }
            for (String command : plan.getUpdateCommands()) {
                out.write(command + "\n");
            }
            for (String note : plan.getReviewNotes()) {
                out.write(note + "\n");
            }
        }
        log.info("wrote {} copy commands to {}", plan.totalCommands(), file);
        return file;
    }

    private static String scopePath(String scope) {
        if (scope == null || CleanupPlanner.SHARED.equals(scope) || CleanupPlanner.UNKNOWN.equals(scope)) {
            return "shared";
        }
        return "device-group " + scope;
    }
}
