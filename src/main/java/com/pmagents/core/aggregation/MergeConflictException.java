package com.pmagents.core.aggregation;

import com.pmagents.core.error.OrchestrationException;
import com.pmagents.core.model.IssueCategory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Two or more tasks produced different content for the same path. Never auto-resolved.
 * Carries the aggregation of every non-conflicting path.
 */
public class MergeConflictException extends OrchestrationException {

    /**
     * One conflicting path and the tasks contending for it.
     */
    public record PathConflict(String path, List<String> taskIds) {

        public PathConflict {
            taskIds = List.copyOf(taskIds);
        }

        @Override
        public String toString() {
            return path + " <- " + String.join(", ", taskIds);
        }
    }

    private final List<PathConflict> conflicts;
    private final AggregatedResult partial;

    public MergeConflictException(List<PathConflict> conflicts, AggregatedResult partial) {
        super(null, "Merge conflict on " + conflicts.size() + " path(s): "
                + conflicts.stream().map(PathConflict::toString).collect(Collectors.joining("; ")));
        this.conflicts = List.copyOf(conflicts);
        this.partial = partial;
    }

    public List<PathConflict> conflicts() {
        return conflicts;
    }

    public AggregatedResult partial() {
        return partial;
    }

    @Override
    public IssueCategory category() {
        return IssueCategory.MERGE_CONFLICT;
    }
}
