package com.pmagents.dispatch.api;

import com.pmagents.core.model.Task;

import java.util.List;

/**
 * Request body for {@code POST /api/v1/graphs/levels}.
 */
public record GraphRequest(List<Task> tasks) {

    public GraphRequest {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
    }
}
