package org.Aayush.panref.report;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Statements that create a copy of an address and wire it into the source's references.
 */
@Value
@Builder
public class AddressCopyPlan {
    String sourceAddress;
    String newAddress;
    /** Scope segment of the source definition, reused for the copy. */
    String scopePath;
    CopyMode mode;
    @Singular
    List<String> createCommands;
    @Singular
    List<String> updateCommands;
    /** Comments for references that need an operator, such as NAT rules. */
    @Singular
    List<String> reviewNotes;
    int groupsToUpdate;
    int securityRulesToUpdate;
    int natRulesToUpdate;

    public int totalCommands() {
        return createCommands.size() + updateCommands.size();
    }
}
