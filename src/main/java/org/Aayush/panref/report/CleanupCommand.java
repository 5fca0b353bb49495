package org.Aayush.panref.report;

import java.util.Objects;

/**
 * One generated cleanup statement.
 *
 * @param section plan section the statement belongs to.
 * @param action effect of the statement.
 * @param command CLI statement, or a {@code #} comment for {@link CommandAction#REVIEW}.
 * @param description one-line explanation written above the statement.
 */
public record CleanupCommand(CleanupSection section, CommandAction action, String command, String description) {

    public CleanupCommand {
        Objects.requireNonNull(section, "section");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(description, "description");
    }
}
