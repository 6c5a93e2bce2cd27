package com.pmagents.core.model;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * An artifact attributed to the task that produced it.
 *
 * @param taskId           producing task
 * @param path             artifact path
 * @param type             artifact type hint
 * @param content          artifact content
 * @param validationStatus validation outcome, {@link DeliverableStatus#SKIPPED} until validated
 */
public record Deliverable(
    String taskId,
    String path,
    String type,
    String content,
    DeliverableStatus validationStatus
) implements Serializable {

    public static Deliverable from(String taskId, Artifact artifact) {
        return new Deliverable(taskId, artifact.path(), artifact.type(), artifact.content(),
                DeliverableStatus.SKIPPED);
    }

    public Deliverable withStatus(DeliverableStatus status) {
        return new Deliverable(taskId, path, type, content, status);
    }

    public Deliverable withPath(String newPath) {
        return new Deliverable(taskId, newPath, type, content, validationStatus);
    }

    /**
     * Byte-level comparison of content, independent of producing task.
     */
    public boolean sameContentAs(Deliverable other) {
        return Arrays.equals(bytes(), other.bytes());
    }

    private byte[] bytes() {
        return content != null ? content.getBytes(StandardCharsets.UTF_8) : new byte[0];
    }
}
