package com.pmagents.core.model;

import java.io.Serializable;

/**
 * An artifact as returned by a worker.
 *
 * @param path    artifact path
 * @param type    artifact type hint
 * @param content artifact content
 */
public record Artifact(
    String path,
    String type,
    String content
) implements Serializable {

    /**
     * The form under which paths are compared: every leading {@code ./} removed.
     */
    public static String normalizePath(String path) {
        var normalized = path;
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }

    public String normalizedPath() {
        return normalizePath(path);
    }
}
