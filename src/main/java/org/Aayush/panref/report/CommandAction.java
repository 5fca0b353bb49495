package org.Aayush.panref.report;

/**
 * What a generated statement does to the configuration.
 *
 * <p>{@link #REVIEW} statements are comments for an operator; they change nothing.</p>
 */
public enum CommandAction {
    ADD,
    DELETE,
    REPLACE,
    REVIEW
}
