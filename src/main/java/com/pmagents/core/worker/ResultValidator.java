package com.pmagents.core.worker;

import com.pmagents.core.model.Artifact;
import com.pmagents.core.model.Task;
import com.pmagents.core.model.TaskResult;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Local structural validation of a worker's {@link TaskResult}.
 * <p>
 * A successful result must carry every required deliverable of the task, with a
 * non-blank path and non-null content, and must report its own validation as passed.
 */
public class ResultValidator {

    /**
     * @return violations; empty when the result is structurally valid
     */
    public List<String> validate(Task task, TaskResult result) {
        var violations = new ArrayList<String>();
        if (result == null) {
            violations.add("worker returned no result");
            return violations;
        }
        if (result.status() == null) {
            violations.add("result status missing");
            return violations;
        }
        if (!result.isSuccess()) {
            return violations;
        }

        var produced = new HashSet<String>();
        for (Artifact artifact : result.deliverables()) {
            if (artifact.path() == null || artifact.path().isBlank()) {
                violations.add("deliverable with blank path");
                continue;
            }
            if (artifact.content() == null) {
                violations.add("deliverable " + artifact.path() + " has no content");
            }
            produced.add(artifact.normalizedPath());
        }

        for (var spec : task.deliverableSpecs()) {
            if (spec.required() && !produced.contains(Artifact.normalizePath(spec.path()))) {
                violations.add("missing required deliverable " + spec.path());
            }
        }

        if (!result.validationPassed()) {
            violations.add("worker reported validation criteria not met");
        }
        return violations;
    }
}
