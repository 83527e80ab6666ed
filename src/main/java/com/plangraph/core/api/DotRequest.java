package com.plangraph.core.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Options of the Graphviz DOT renderer.
 *
 * @param includeDescriptions attach node descriptions as edge end labels
 */
public record DotRequest(boolean includeDescriptions) {

    public static final DotRequest DEFAULT = new DotRequest(true);

    @JsonCreator
    static DotRequest fromJson(@JsonProperty("include_descriptions") Boolean includeDescriptions) {
        return new DotRequest(includeDescriptions == null || includeDescriptions);
    }
}
