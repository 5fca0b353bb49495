package org.Aayush.panref.model;

import java.util.Objects;

/**
 * One address-group definition as written in the configuration.
 *
 * @param name group name.
 * @param scope shared or device-group scoped.
 * @param deviceGroup owning device group, null for shared groups.
 * @param definition raw member list text (for example {@code [ web1 web2 ]}).
 */
public record AddressGroupDescriptor(String name, GroupScope scope, String deviceGroup, String definition) {

    public AddressGroupDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(definition, "definition");
        if (scope == GroupScope.DEVICE_GROUP) {
            Objects.requireNonNull(deviceGroup, "deviceGroup");
        } else if (deviceGroup != null) {
            throw new IllegalArgumentException("shared group cannot carry a device group: " + deviceGroup);
        }
    }

    public static AddressGroupDescriptor shared(String name, String definition) {
        return new AddressGroupDescriptor(name, GroupScope.SHARED, null, definition);
    }

    public static AddressGroupDescriptor scoped(String deviceGroup, String name, String definition) {
        return new AddressGroupDescriptor(name, GroupScope.DEVICE_GROUP, deviceGroup, definition);
    }

    public boolean isShared() {
        return scope == GroupScope.SHARED;
    }

    /**
     * Reconstructs the {@code set ... address-group ... static ...} command defining this group.
     */
    public String definitionCommand() {
        return commandPrefix() + " " + name + " static " + definition;
    }

    /**
     * Returns the command prefix up to and including {@code address-group}.
     */
    public String commandPrefix() {
        return "set " + scopePath() + " address-group";
    }

    /**
     * Returns the scope segment of a command: {@code shared} or {@code device-group <dg>}.
     */
    public String scopePath() {
        return isShared() ? "shared" : "device-group " + deviceGroup;
    }
}
