package com.plangraph.core.model;

import java.util.Objects;

/**
 * Fields shared by every plan element.
 *
 * @param id          plan-wide unique identifier
 * @param description free text, empty when absent
 * @param status      current status
 * @param priority    priority level (1 when absent)
 */
public record NodeFields(
    String id,
    String description,
    Status status,
    int priority
) {
    public NodeFields {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        description = description != null ? description : "";
    }
}
