package org.Aayush.panref.core;

/**
 * Stages of one engine run.
 */
public enum ScanStage {
    PRIMARY_SCAN,
    REDUNDANCY,
    INDIRECT_RULES,
    NESTED_GROUPS
}
