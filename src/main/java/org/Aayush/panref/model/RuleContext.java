package org.Aayush.panref.model;

/**
 * Where in a rule line a name appeared.
 */
public enum RuleContext {
    DIRECT_REFERENCE("references directly"),
    DESTINATION_FIELD("contains address in destination"),
    SOURCE_FIELD("contains address in source"),
    SERVICE_FIELD("references address in service field");

    private final String description;

    RuleContext(String description) {
        this.description = description;
    }

    /**
     * Human-readable label used by reports.
     */
    public String description() {
        return description;
    }
}
