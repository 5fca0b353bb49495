package org.Aayush.panref.model;

import java.util.Objects;

/**
 * Explanation of why a rule references a target through one of its address groups.
 *
 * @param group group the rule line names.
 * @param target target address contained in the group.
 * @param inDestination group name appears after a {@code destination} keyword.
 * @param inSource group name appears after a {@code source} keyword.
 */
public record IndirectRuleContext(
        AddressGroupDescriptor group,
        String target,
        boolean inDestination,
        boolean inSource
) {

    public IndirectRuleContext {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(target, "target");
    }

    /**
     * Renders the generated explanation, for example
     * {@code references shared address-group 'WEB' that contains web1 (in destination)}.
     */
    public String describe() {
        StringBuilder text = new StringBuilder("references ");
        if (group.isShared()) {
            text.append("shared address-group '").append(group.name()).append('\'');
        } else {
            text.append("address-group '").append(group.name())
                    .append("' from device-group '").append(group.deviceGroup()).append('\'');
        }
        text.append(" that contains ").append(target);
        if (inDestination) {
            text.append(" (in destination)");
        }
        if (inSource) {
            text.append(" (in source)");
        }
        return text.toString();
    }
}
