package org.Aayush.panref.model;

import java.util.Objects;

/**
 * Another address object defined with the same IP/netmask as a target.
 *
 * @param name peer address name.
 * @param ipNetmask shared IP/netmask value.
 * @param deviceGroup {@code shared}, the owning device group, or {@code Unknown}.
 */
public record RedundantAddress(String name, String ipNetmask, String deviceGroup) {

    public RedundantAddress {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(ipNetmask, "ipNetmask");
        Objects.requireNonNull(deviceGroup, "deviceGroup");
    }
}
