package com.plangraph.core.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Options of the Mermaid flowchart renderer.
 *
 * @param includeDescriptions label both endpoints of every edge with their description
 */
public record FlowchartRequest(boolean includeDescriptions) {

    public static final FlowchartRequest DEFAULT = new FlowchartRequest(true);

    @JsonCreator
    static FlowchartRequest fromJson(@JsonProperty("include_descriptions") Boolean includeDescriptions) {
        return new FlowchartRequest(includeDescriptions == null || includeDescriptions);
    }
}
