package com.plangraph.core.model;

import java.util.List;

/**
 * Root aggregate of a parsed plan document. Rebuilt on every parse, never
 * updated in place.
 *
 * @param version value of the root {@code version} attribute
 * @param epics   epics in document order
 */
public record Plan(
    String version,
    List<EpicNode> epics
) {
    public Plan {
        epics = epics != null ? List.copyOf(epics) : List.of();
    }

    public static Plan empty() {
        return new Plan("", List.of());
    }
}
