package org.Aayush.panref.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Aggregated result of one engine run.
 *
 * <p>{@code status} is {@link StageStatus#FATAL} when the primary scan (or target
 * validation) failed, {@link StageStatus#DEGRADED} when at least one resolver stage
 * degraded, else {@link StageStatus#SUCCEEDED}.</p>
 */
@Value
@Builder
public class RunOutcome {
    /** Overall run status. */
    StageStatus status;
    /** Reason code of the fatal failure, null otherwise. */
    String reasonCode;
    /** Fatal failure description, null otherwise. */
    String message;
    /** Target addresses of the run in catalogue order. */
    @Singular
    List<String> addresses;
    /** Outcomes of the stages that ran, in execution order. */
    @Singular
    List<StageOutcome> stages;

    /**
     * Returns true when results are available (succeeded or degraded).
     */
    public boolean isSuccess() {
        return status != StageStatus.FATAL;
    }

    /**
     * Returns the outcome of one stage, or null when it did not run.
     */
    public StageOutcome stage(ScanStage stage) {
        for (StageOutcome outcome : stages) {
            if (outcome.stage() == stage) {
                return outcome;
            }
        }
        return null;
    }
}
