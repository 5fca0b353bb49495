package org.Aayush.panref.report;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Commands that fold the redundant peers of one address into it.
 */
@Value
@Builder
public class CleanupPlan {
    /** Address that survives the cleanup. */
    String targetAddress;
    /** {@code shared}, the defining device group, or {@code Unknown}. */
    String targetScope;
    /** True when the target must be recreated in shared scope. */
    boolean promoteToShared;
    /** Peer names folded into the target, in detection order. */
    @Singular
    List<String> redundantAddresses;
    /** Device groups where any peer is used. */
    @Singular
    List<String> affectedDeviceGroups;
    /** Statements in section order. */
    @Singular
    List<CleanupCommand> commands;

    /**
     * Returns the statements of one section.
     */
    public List<CleanupCommand> commands(CleanupSection section) {
        List<CleanupCommand> selected = new ArrayList<>();
        for (CleanupCommand command : commands) {
            if (command.section() == section) {
                selected.add(command);
            }
        }
        return selected;
    }

    /**
     * Counts statements that change the configuration, leaving out review notes.
     */
    public int executableCount() {
        int count = 0;
        for (CleanupCommand command : commands) {
            if (command.action() != CommandAction.REVIEW) {
                count++;
            }
        }
        return count;
    }
}
