package org.Aayush.panref.model;

import java.util.Objects;

/**
 * One {@code address <name> ip-netmask <cidr>} definition observed in the configuration.
 *
 * @param name address object name.
 * @param ipNetmask IP/netmask literal.
 * @param scope shared or device-group scoped.
 * @param deviceGroup owning device group, null when shared.
 * @param line trimmed defining line.
 */
public record AddressDefinition(String name, String ipNetmask, GroupScope scope, String deviceGroup, String line) {

    public AddressDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(ipNetmask, "ipNetmask");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(line, "line");
    }
}
