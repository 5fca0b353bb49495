package org.Aayush.panref.model;

/**
 * Definition scope of an address or address group.
 */
public enum GroupScope {
    /** Defined under {@code set shared}. */
    SHARED,
    /** Defined under {@code set device-group <dg>}. */
    DEVICE_GROUP
}
