package com.plangraph.core.model;

import java.util.Optional;

/**
 * Status of a plan element. The wire value is the lower-case string carried by
 * the {@code status} attribute of an epic, story or task.
 */
public enum Status {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETE("complete");

    private final String value;

    Status(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Exact, case-sensitive lookup of a raw attribute value.
     *
     * @param raw attribute text, may be null
     * @return the matching status, or empty when the value is unknown
     */
    public static Optional<Status> fromValue(String raw) {
        if (raw == null) return Optional.empty();
        for (Status s : values()) {
            if (s.value.equals(raw)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
