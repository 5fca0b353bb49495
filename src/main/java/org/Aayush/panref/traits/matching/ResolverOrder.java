package org.Aayush.panref.traits.matching;

/**
 * Order in which resolver stages run after the primary scan.
 *
 * <p>Redundancy detection always runs first.</p>
 */
public enum ResolverOrder {
    /**
     * Redundancy, then indirect rules, then nested groups. The indirect resolver
     * does not see groups that only the nested resolver discovers, so rules naming
     * such an outer group are not reported.
     */
    COMPATIBLE,
    /**
     * Redundancy, then nested groups, then indirect rules. Rules referencing an
     * outer group found through one-level nesting become indirect rules too.
     */
    NESTED_BEFORE_INDIRECT
}
