package com.plangraph.core.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Options of the ready-task query.
 *
 * @param includeInProgress also report tasks that are already in progress
 */
public record ReadyTasksRequest(boolean includeInProgress) {

    public static final ReadyTasksRequest DEFAULT = new ReadyTasksRequest(false);

    @JsonCreator
    static ReadyTasksRequest fromJson(@JsonProperty("include_in_progress") Boolean includeInProgress) {
        return new ReadyTasksRequest(includeInProgress != null && includeInProgress);
    }
}
