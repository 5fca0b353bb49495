package org.Aayush.panref.core;

import java.util.Objects;

/**
 * Typed result of one stage.
 *
 * @param stage stage that ran.
 * @param status stage status.
 * @param factsAdded facts contributed by the stage (0 when not succeeded).
 * @param reasonCode reason code for non-succeeded stages, otherwise null.
 * @param message failure description for non-succeeded stages, otherwise null.
 */
public record StageOutcome(ScanStage stage, StageStatus status, int factsAdded, String reasonCode, String message) {

    public StageOutcome {
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(status, "status");
        if (status != StageStatus.SUCCEEDED) {
            Objects.requireNonNull(reasonCode, "reasonCode");
        }
    }

    public static StageOutcome succeeded(ScanStage stage, int factsAdded) {
        return new StageOutcome(stage, StageStatus.SUCCEEDED, factsAdded, null, null);
    }

    public static StageOutcome degraded(ScanStage stage, String reasonCode, String message) {
        return new StageOutcome(stage, StageStatus.DEGRADED, 0, reasonCode, message);
    }

    public static StageOutcome fatal(ScanStage stage, String reasonCode, String message) {
        return new StageOutcome(stage, StageStatus.FATAL, 0, reasonCode, message);
    }
}
