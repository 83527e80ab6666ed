package com.plangraph.core.schema;

/**
 * Thrown when a plan document cannot be turned into a graph at all.
 * No partial graph exists when this is raised.
 */
public class PlanBuildException extends Exception {

    public enum Kind {
        /** Well-formed XML that breaks the plan schema. */
        SCHEMA_VIOLATION,
        /** Not well-formed XML. */
        MALFORMED_DOCUMENT,
        /** Plan file missing or unreadable. */
        IO_FAILURE,
        /** The plan schema resource itself is missing or invalid. */
        SCHEMA_UNAVAILABLE
    }

    private final Kind kind;

    public PlanBuildException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PlanBuildException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
