package org.Aayush.panref.core;

/**
 * Result status of one stage or of a whole run.
 */
public enum StageStatus {
    /** Completed normally. */
    SUCCEEDED,
    /** Failed but recoverable; earlier results are kept and the run continues. */
    DEGRADED,
    /** Unrecoverable; the run stops and no results are exposed. */
    FATAL
}
