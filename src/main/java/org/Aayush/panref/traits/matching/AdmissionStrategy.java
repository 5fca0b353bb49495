package org.Aayush.panref.traits.matching;

/**
 * Strategy contract deciding whether a line mentions a name.
 *
 * <p>This is the sole admission filter of the primary scan: a line is examined for
 * rule, group, NAT and service facts only through the targets it admits. Resolver
 * stages use the same strategy to spot group names on rule lines.</p>
 */
public interface AdmissionStrategy {

    /**
     * Stable strategy identifier.
     */
    String id();

    /**
     * Returns true when {@code line} mentions {@code name}.
     */
    boolean admits(String line, String name);
}
