package org.Aayush.panref.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-target result record accumulated across the scan and resolver stages.
 *
 * <p>Every collection is insertion ordered so repeated runs over the same input
 * compare equal. Getters return unmodifiable views. Writers are the engine and
 * its resolver stages; once the run is over the engine calls {@link #seal()} and
 * every mutator throws {@link UnsupportedOperationException}.</p>
 *
 * <p>Direct and indirect rule maps are mutually exclusive by rule name:
 * {@link #putIndirectRule} refuses names already present as direct rules and
 * {@link #putDirectRule} evicts an indirect entry for the same name.</p>
 */
@EqualsAndHashCode
@ToString(onlyExplicitlyIncluded = true)
public final class AddressResult {
    @ToString.Include
    private final String address;
    private final List<String> matchingLines = new ArrayList<>();
    private final Set<String> deviceGroups = new LinkedHashSet<>();
    private final Map<String, String> directRules = new LinkedHashMap<>();
    private final Map<String, RuleContext> directRuleContexts = new LinkedHashMap<>();
    private final Map<String, String> indirectRules = new LinkedHashMap<>();
    private final Map<String, IndirectRuleContext> indirectRuleContexts = new LinkedHashMap<>();
    private final List<AddressGroupDescriptor> addressGroups = new ArrayList<>();
    private final Set<String> natRules = new LinkedHashSet<>();
    private final Set<String> serviceGroups = new LinkedHashSet<>();
    @ToString.Include
    private String ipNetmask;
    private final List<RedundantAddress> redundantAddresses = new ArrayList<>();
    @ToString.Include
    private String definitionScope;
    @EqualsAndHashCode.Exclude
    private boolean sealed;

    public AddressResult(String address) {
        this.address = Objects.requireNonNull(address, "address");
    }

    public String address() {
        return address;
    }

    public List<String> matchingLines() {
        return Collections.unmodifiableList(matchingLines);
    }

    public Set<String> deviceGroups() {
        return Collections.unmodifiableSet(deviceGroups);
    }

    public Map<String, String> directRules() {
        return Collections.unmodifiableMap(directRules);
    }

    public Map<String, RuleContext> directRuleContexts() {
        return Collections.unmodifiableMap(directRuleContexts);
    }

    public Map<String, String> indirectRules() {
        return Collections.unmodifiableMap(indirectRules);
    }

    public Map<String, IndirectRuleContext> indirectRuleContexts() {
        return Collections.unmodifiableMap(indirectRuleContexts);
    }

    public List<AddressGroupDescriptor> addressGroups() {
        return Collections.unmodifiableList(addressGroups);
    }

    public Set<String> natRules() {
        return Collections.unmodifiableSet(natRules);
    }

    public Set<String> serviceGroups() {
        return Collections.unmodifiableSet(serviceGroups);
    }

    /**
     * IP/netmask from this address's own definition line, or null when never defined.
     */
    public String ipNetmask() {
        return ipNetmask;
    }

    /**
     * Scope of this address's first definition line: {@code shared}, the owning
     * device group, or null when never defined.
     */
    public String definitionScope() {
        return definitionScope;
    }

    public List<RedundantAddress> redundantAddresses() {
        return Collections.unmodifiableList(redundantAddresses);
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * Makes this record read-only. Irreversible.
     */
    public void seal() {
        sealed = true;
    }

    /**
     * Returns true when at least one line mentioned this address.
     */
    public boolean hasMatches() {
        return !matchingLines.isEmpty();
    }

    /**
     * Returns true when the named group is already attached to this address.
     */
    public boolean hasAddressGroup(String groupName) {
        for (AddressGroupDescriptor group : addressGroups) {
            if (group.name().equals(groupName)) {
                return true;
            }
        }
        return false;
    }

    public void addMatchingLine(String line) {
        checkWritable();
        matchingLines.add(Objects.requireNonNull(line, "line"));
    }

    public void addDeviceGroup(String deviceGroup) {
        checkWritable();
        deviceGroups.add(Objects.requireNonNull(deviceGroup, "deviceGroup"));
    }

    public void putDirectRule(String ruleName, String deviceGroup, RuleContext context) {
        checkWritable();
        Objects.requireNonNull(ruleName, "ruleName");
        directRules.put(ruleName, Objects.requireNonNull(deviceGroup, "deviceGroup"));
        directRuleContexts.put(ruleName, Objects.requireNonNull(context, "context"));
        indirectRules.remove(ruleName);
        indirectRuleContexts.remove(ruleName);
    }

    /**
     * Records an indirect rule unless the same rule name is already a direct rule.
     *
     * @return true when the indirect entry was recorded.
     */
    public boolean putIndirectRule(String ruleName, String deviceGroup, IndirectRuleContext context) {
        checkWritable();
        Objects.requireNonNull(ruleName, "ruleName");
        if (directRules.containsKey(ruleName)) {
            return false;
        }
        indirectRules.put(ruleName, Objects.requireNonNull(deviceGroup, "deviceGroup"));
        indirectRuleContexts.put(ruleName, Objects.requireNonNull(context, "context"));
        return true;
    }

    /**
     * Attaches a group unless one with the same name is already attached.
     *
     * @return true when the group was attached.
     */
    public boolean addAddressGroup(AddressGroupDescriptor group) {
        checkWritable();
        Objects.requireNonNull(group, "group");
        if (hasAddressGroup(group.name())) {
            return false;
        }
        addressGroups.add(group);
        return true;
    }

    public void addNatRule(String natRule) {
        checkWritable();
        natRules.add(Objects.requireNonNull(natRule, "natRule"));
    }

    public void addServiceGroup(String serviceGroup) {
        checkWritable();
        serviceGroups.add(Objects.requireNonNull(serviceGroup, "serviceGroup"));
    }

    public void setIpNetmask(String ipNetmask) {
        checkWritable();
        this.ipNetmask = Objects.requireNonNull(ipNetmask, "ipNetmask");
    }

    /**
     * Records the scope of the first definition; later definitions are ignored.
     */
    public void recordDefinitionScope(String scope) {
        checkWritable();
        if (definitionScope == null) {
            definitionScope = Objects.requireNonNull(scope, "scope");
        }
    }

    public void addRedundantAddress(RedundantAddress peer) {
        checkWritable();
        Objects.requireNonNull(peer, "peer");
        if (peer.name().equals(address)) {
            throw new IllegalArgumentException("address cannot be redundant with itself: " + address);
        }
        redundantAddresses.add(peer);
    }

    private void checkWritable() {
        if (sealed) {
            throw new UnsupportedOperationException("result record of '" + address + "' is read-only");
        }
    }
}
