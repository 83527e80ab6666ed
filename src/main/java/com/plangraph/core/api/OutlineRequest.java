package com.plangraph.core.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Options of the outline renderer.
 *
 * @param includeStatus append {@code (status)} to every line
 */
public record OutlineRequest(boolean includeStatus) {

    public static final OutlineRequest DEFAULT = new OutlineRequest(true);

    @JsonCreator
    static OutlineRequest fromJson(@JsonProperty("include_status") Boolean includeStatus) {
        return new OutlineRequest(includeStatus == null || includeStatus);
    }
}
