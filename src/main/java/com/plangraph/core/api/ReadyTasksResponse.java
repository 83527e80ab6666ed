package com.plangraph.core.api;

import java.util.List;

/**
 * Ids of the tasks that can start now, in graph node order.
 */
public record ReadyTasksResponse(List<String> tasks) {
    public ReadyTasksResponse {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
    }
}
