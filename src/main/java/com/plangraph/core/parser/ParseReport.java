package com.plangraph.core.parser;

import java.util.List;

/**
 * Outcome of the local failure policy for one parse.
 *
 * @param elementsSeen     epic, story and task elements the parser inspected
 * @param elementsAccepted elements that made it into the plan
 * @param dropped          rejected elements in document order
 */
public record ParseReport(
    int elementsSeen,
    int elementsAccepted,
    List<DroppedElement> dropped
) {
    public ParseReport {
        dropped = dropped != null ? List.copyOf(dropped) : List.of();
    }

    public static ParseReport empty() {
        return new ParseReport(0, 0, List.of());
    }

    public boolean hasDrops() {
        return !dropped.isEmpty();
    }
}
