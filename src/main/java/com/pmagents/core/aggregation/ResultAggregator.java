package com.pmagents.core.aggregation;

import com.pmagents.core.model.Artifact;
import com.pmagents.core.model.Deliverable;
import com.pmagents.core.model.DeliverableStatus;
import com.pmagents.core.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges the deliverables of completed tasks into one path-indexed set.
 *
 * <p>Paths are compared in their {@link Artifact#normalizePath normalized} form. A path
 * produced by several tasks with byte-identical content is kept once; differing content is
 * a conflict. All conflicts are collected before {@link MergeConflictException} is thrown.
 */
@Service
public class ResultAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    /**
     * @param results worker results keyed by task id
     * @throws MergeConflictException if any path has differing content
     */
    public AggregatedResult aggregate(Map<String, TaskResult> results) {
        var byPath = new TreeMap<String, List<Deliverable>>();
        var metrics = new LinkedHashMap<String, Map<String, Double>>();

        for (var entry : new TreeMap<>(results).entrySet()) {
            var taskId = entry.getKey();
            var result = entry.getValue();
            if (!result.metrics().isEmpty()) {
                metrics.put(taskId, result.metrics());
            }
            for (Artifact artifact : result.deliverables()) {
                var path = artifact.normalizedPath();
                byPath.computeIfAbsent(path, k -> new ArrayList<>())
                        .add(Deliverable.from(taskId, artifact).withPath(path));
            }
        }

        var accepted = new ArrayList<Deliverable>();
        var deduplicated = new ArrayList<String>();
        var conflicts = new ArrayList<MergeConflictException.PathConflict>();

        for (var entry : byPath.entrySet()) {
            var versions = entry.getValue();
            var first = versions.get(0);
            if (versions.size() == 1) {
                accepted.add(validate(first));
                continue;
            }
            boolean identical = versions.stream().allMatch(first::sameContentAs);
            if (identical) {
                log.debug("Path {} produced identically by {} tasks; keeping one", entry.getKey(), versions.size());
                deduplicated.add(entry.getKey());
                accepted.add(validate(first));
            } else {
                var taskIds = versions.stream().map(Deliverable::taskId).distinct().sorted().toList();
                conflicts.add(new MergeConflictException.PathConflict(entry.getKey(), taskIds));
            }
        }

        var aggregated = new AggregatedResult(accepted, metrics, deduplicated);
        if (!conflicts.isEmpty()) {
            log.error("Merge conflict on {} path(s): {}", conflicts.size(), conflicts);
            throw new MergeConflictException(conflicts, aggregated);
        }
        log.info("Aggregated {} deliverable(s) from {} task(s)", accepted.size(), results.size());
        return aggregated;
    }

    private Deliverable validate(Deliverable deliverable) {
        var content = deliverable.content();
        return deliverable.withStatus(content == null || content.isBlank()
                ? DeliverableStatus.FAILED
                : DeliverableStatus.PASSED);
    }
}
