package org.Aayush.panref.report;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.panref.classify.MemberListParser;
import org.Aayush.panref.model.AddressGroupDescriptor;
import org.Aayush.panref.model.AddressResult;
import org.Aayush.panref.model.RedundantAddress;
import org.Aayush.panref.model.RuleContext;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Plans the removal of addresses that duplicate a target's IP/netmask.
 *
 * <p>Every peer reference is moved onto the target and the peer definitions are
 * deleted. When the peers are used outside the target's own device group the
 * target is recreated in shared scope first. NAT rules and service groups are
 * only flagged for review because their field layout is not tracked.</p>
 *
 * <p>Usage of the peers comes from result records of a run that targeted the
 * peers themselves; a peer absent from that map is treated as unused.</p>
 */
@Slf4j
public final class CleanupPlanner {
    static final String SHARED = "shared";
    static final String UNKNOWN = "Unknown";

    /**
     * Builds the cleanup plan for one target.
     *
     * @param target sealed result record of the address to keep.
     * @param peerUsage result records of the redundant peers, keyed by peer name.
     * @return ordered cleanup plan.
     * @throws IllegalArgumentException when the target has no redundant addresses.
     */
    public CleanupPlan plan(AddressResult target, Map<String, AddressResult> peerUsage) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(peerUsage, "peerUsage");
        if (target.redundantAddresses().isEmpty()) {
            throw new IllegalArgumentException("no redundant addresses found for '" + target.address() + "'");
        }
        String name = target.address();
        String scope = target.definitionScope() == null ? UNKNOWN : target.definitionScope();

        Set<String> peers = new LinkedHashSet<>();
        for (RedundantAddress peer : target.redundantAddresses()) {
            peers.add(peer.name());
        }
        Set<String> affected = new LinkedHashSet<>();
        for (String peer : peers) {
            AddressResult usage = peerUsage.get(peer);
            if (usage != null) {
                affected.addAll(usage.deviceGroups());
            }
        }
        boolean promote = shouldPromoteToShared(scope, affected);

        CleanupPlan.CleanupPlanBuilder plan = CleanupPlan.builder()
                .targetAddress(name)
                .targetScope(scope)
                .promoteToShared(promote)
                .redundantAddresses(peers)
                .affectedDeviceGroups(affected);

        if (promote) {
            plan.command(new CleanupCommand(CleanupSection.TARGET_CREATION, CommandAction.ADD,
                    "set shared address " + name + " ip-netmask " + ipNetmask(target),
                    "Create '" + name + "' in shared scope for use across device groups"));
        }
        addDefinitionDeletes(plan, target.redundantAddresses());
        addGroupReplacements(plan, name, peers, peerUsage);
        addRuleReplacements(plan, name, peers, peerUsage);
        for (String peer : peers) {
            AddressResult usage = peerUsage.get(peer);
            if (usage == null) {
                continue;
            }
            for (String natRule : usage.natRules()) {
                plan.command(new CleanupCommand(CleanupSection.NAT_RULES, CommandAction.REVIEW,
                        "# NAT rule " + natRule + " contains " + peer + " - manual review required for replacement with " + name,
                        "Review NAT rule '" + natRule + "'"));
            }
            for (String serviceGroup : usage.serviceGroups()) {
                plan.command(new CleanupCommand(CleanupSection.SERVICE_GROUPS, CommandAction.REVIEW,
                        "# Service group " + serviceGroup + " references " + peer + " - manual review required for replacement with " + name,
                        "Review service group '" + serviceGroup + "'"));
            }
        }

        CleanupPlan built = plan.build();
        log.debug("cleanup plan for {}: {} peers, {} commands, promote={}",
                name, peers.size(), built.getCommands().size(), promote);
        return built;
    }

    /**
     * Returns true when the peers are used where a target of {@code targetScope} cannot be seen.
     */
    static boolean shouldPromoteToShared(String targetScope, Set<String> affectedDeviceGroups) {
        if (SHARED.equals(targetScope)) {
            return false;
        }
        if (affectedDeviceGroups.size() > 1) {
            return true;
        }
        if (UNKNOWN.equals(targetScope)) {
            return false;
        }
        for (String deviceGroup : affectedDeviceGroups) {
            if (!deviceGroup.equals(targetScope)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the conventional cleanup file name for a target.
     */
    public static String cleanupFileName(String targetAddress) {
        return "cleanup_" + Objects.requireNonNull(targetAddress, "targetAddress").trim() + "_commands.txt";
    }

    /**
     * Writes {@code plan} into {@code directory}, one block per non-empty section.
     *
     * @return path of the written file.
     */
    public Path writeCommandFile(Path directory, CleanupPlan plan) throws IOException {
        Path file = Objects.requireNonNull(directory, "directory").resolve(cleanupFileName(plan.getTargetAddress()));
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write("# Cleanup commands for redundant addresses of '" + plan.getTargetAddress() + "'\n");
            out.write("# Redundant addresses: " + String.join(", ", plan.getRedundantAddresses()) + "\n");
            out.write("# Target scope: " + plan.getTargetScope() + "\n");
            out.write("# Promote to shared: " + (plan.isPromoteToShared() ? "yes" : "no") + "\n");
            out.write("# Total commands: " + plan.getCommands().size() + "\n");
            for (CleanupSection section : CleanupSection.values()) {
                List<CleanupCommand> commands = plan.commands(section);
                if (commands.isEmpty()) {
                    continue;
                }
                out.write("\n# --- " + section.label() + " ---\n");
                for (CleanupCommand command : commands) {
                    if (command.action() != CommandAction.REVIEW) {
                        out.write("# " + command.description() + "\n");
                    }
                    out.write(command.command() + "\n");
                }
            }
        }
        log.info("wrote {} cleanup commands to {}", plan.getCommands().size(), file);
        return file;
    }

    private static void addDefinitionDeletes(CleanupPlan.CleanupPlanBuilder plan, List<RedundantAddress> redundant) {
        Set<String> seen = new LinkedHashSet<>();
        for (RedundantAddress peer : redundant) {
            String scope = peer.deviceGroup();
            if (!seen.add(peer.name() + "|" + scope)) {
                continue;
            }
            if (UNKNOWN.equals(scope)) {
                plan.command(new CleanupCommand(CleanupSection.DEFINITIONS, CommandAction.REVIEW,
                        "# Address " + peer.name() + " has no recognised scope - remove its definition manually",
                        "Remove '" + peer.name() + "'"));
                continue;
            }
            String command = SHARED.equals(scope)
                    ? "delete shared address " + peer.name()
                    : "delete device-group " + scope + " address " + peer.name();
            plan.command(new CleanupCommand(CleanupSection.DEFINITIONS, CommandAction.DELETE, command,
                    "Remove redundant address '" + peer.name() + "' (" + peer.ipNetmask() + ")"));
        }
    }

    private static void addGroupReplacements(CleanupPlan.CleanupPlanBuilder plan, String target,
                                             Set<String> peers, Map<String, AddressResult> peerUsage) {
        Map<String, AddressGroupDescriptor> groups = new LinkedHashMap<>();
        Map<String, List<String>> members = new LinkedHashMap<>();
        Map<String, Set<String>> replaced = new LinkedHashMap<>();
        for (String peer : peers) {
            AddressResult usage = peerUsage.get(peer);
            if (usage == null) {
                continue;
            }
            for (AddressGroupDescriptor group : usage.addressGroups()) {
                String key = group.scopePath() + "|" + group.name();
                List<String> current = members.computeIfAbsent(key,
                        k -> new ArrayList<>(MemberListParser.parse(group.definition())));
                if (!current.contains(peer)) {
                    continue;
                }
                groups.putIfAbsent(key, group);
                replaced.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(peer);
                List<String> updated = new ArrayList<>();
                for (String member : current) {
                    String next = member.equals(peer) ? target : member;
                    if (!updated.contains(next)) {
                        updated.add(next);
                    }
                }
                members.put(key, updated);
            }
        }
        for (Map.Entry<String, AddressGroupDescriptor> entry : groups.entrySet()) {
            AddressGroupDescriptor group = entry.getValue();
            String definition = "[ " + String.join(" ", members.get(entry.getKey())) + " ]";
            plan.command(new CleanupCommand(CleanupSection.ADDRESS_GROUPS, CommandAction.REPLACE,
                    group.commandPrefix() + " " + group.name() + " static " + definition,
                    "Replace " + String.join(", ", replaced.get(entry.getKey()))
                            + " with " + target + " in address-group " + group.name()));
        }
    }

    private static void addRuleReplacements(CleanupPlan.CleanupPlanBuilder plan, String target,
                                            Set<String> peers, Map<String, AddressResult> peerUsage) {
        for (String peer : peers) {
            AddressResult usage = peerUsage.get(peer);
            if (usage == null) {
                continue;
            }
            for (Map.Entry<String, String> rule : usage.directRules().entrySet()) {
                String ruleName = rule.getKey();
                String deviceGroup = rule.getValue();
                String field = fieldOf(usage.directRuleContexts().get(ruleName));
                if (field == null || UNKNOWN.equals(deviceGroup)) {
                    plan.command(new CleanupCommand(CleanupSection.SECURITY_RULES, CommandAction.REVIEW,
                            "# Security rule " + ruleName + " references " + peer
                                    + " - manual review required for replacement with " + target,
                            "Review security rule '" + ruleName + "'"));
                    continue;
                }
                plan.command(new CleanupCommand(CleanupSection.SECURITY_RULES, CommandAction.REPLACE,
                        "set device-group " + deviceGroup + " security rules " + quoted(ruleName) + " " + field + " " + target,
                        "Reference " + target + " instead of " + peer + " in the " + field + " of rule " + ruleName));
            }
        }
    }

    /**
     * Maps a rule context to the rule field holding the address, or null when the field is unknown.
     */
    static String fieldOf(RuleContext context) {
        if (context == RuleContext.SOURCE_FIELD) {
            return "source";
        }
        if (context == RuleContext.DESTINATION_FIELD) {
            return "destination";
        }
        return null;
    }

    private static String ipNetmask(AddressResult target) {
        if (target.ipNetmask() != null) {
            return target.ipNetmask();
        }
        return target.redundantAddresses().get(0).ipNetmask();
    }

    static String quoted(String name) {
        if (name.startsWith("\"") || name.chars().noneMatch(Character::isWhitespace)) {
            return name;
        }
        return "\"" + name + "\"";
    }
}
