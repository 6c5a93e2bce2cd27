package com.pmagents.core.model;

import java.io.Serializable;

/**
 * An artifact a task is expected to produce.
 *
 * @param path     artifact path relative to the project root (e.g. "src/App.tsx")
 * @param type     artifact type hint (e.g. "source", "markdown", "config")
 * @param required whether a result missing this artifact is structurally invalid
 */
public record DeliverableSpec(
    String path,
    String type,
    boolean required
) implements Serializable {

    public static DeliverableSpec required(String path, String type) {
        return new DeliverableSpec(path, type, true);
    }

    public static DeliverableSpec optional(String path, String type) {
        return new DeliverableSpec(path, type, false);
    }
}
