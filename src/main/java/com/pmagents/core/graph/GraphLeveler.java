package com.pmagents.core.graph;

import com.pmagents.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Validates a task set and groups it into concurrency levels.
 *
 * <p>A task's level is 0 when it has no dependencies, otherwise one more than the
 * highest level among its dependencies. Two tasks in the same level never depend on
 * each other, directly or transitively, so a level can be dispatched concurrently.
 * Ids within a level are sorted for deterministic ordering.
 */
public final class GraphLeveler {

    private static final Logger log = LoggerFactory.getLogger(GraphLeveler.class);

    private GraphLeveler() {}

    /**
     * Compute the levels of a task set.
     *
     * @param tasks tasks with unique ids
     * @return ordered levels, each a sorted list of task ids
     * @throws IllegalArgumentException    if two tasks share an id
     * @throws UnknownDependencyException  if a dependency id is not in the set
     * @throws CycleException              if the dependency relation is cyclic
     */
    public static List<List<String>> buildLevels(Collection<Task> tasks) {
        var byId = index(tasks);

        for (var task : byId.values()) {
            for (var dep : new TreeSet<>(task.dependencies())) {
                if (!byId.containsKey(dep)) {
                    throw new UnknownDependencyException(task.id(), dep);
                }
            }
        }

        // Kahn's algorithm, tracking the longest path to each task
        var remainingDeps = new HashMap<String, Integer>();
        var dependents = new HashMap<String, List<String>>();
        for (var task : byId.values()) {
            remainingDeps.put(task.id(), task.dependencies().size());
            for (var dep : task.dependencies()) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(task.id());
            }
        }

        var levelOf = new HashMap<String, Integer>();
        var ready = new ArrayDeque<String>();
        for (var id : new TreeSet<>(byId.keySet())) {
            if (remainingDeps.get(id) == 0) {
                ready.add(id);
                levelOf.put(id, 0);
            }
        }

        int processed = 0;
        while (!ready.isEmpty()) {
            var id = ready.poll();
            processed++;
            int level = levelOf.get(id);
            for (var dependent : dependents.getOrDefault(id, List.of())) {
                levelOf.merge(dependent, level + 1, Math::max);
                if (remainingDeps.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (processed < byId.size()) {
            var unresolved = new TreeSet<String>();
            remainingDeps.forEach((id, count) -> {
                if (count > 0) unresolved.add(id);
            });
            throw new CycleException(findCycle(byId, unresolved));
        }

        var grouped = new TreeMap<Integer, List<String>>();
        levelOf.forEach((id, level) -> grouped.computeIfAbsent(level, k -> new ArrayList<>()).add(id));

        var levels = new ArrayList<List<String>>();
        for (var ids : grouped.values()) {
            Collections.sort(ids);
            levels.add(List.copyOf(ids));
        }
        log.debug("Leveled {} tasks into {} levels", byId.size(), levels.size());
        return List.copyOf(levels);
    }

    private static Map<String, Task> index(Collection<Task> tasks) {
        var byId = new LinkedHashMap<String, Task>();
        for (var task : tasks) {
            if (byId.putIfAbsent(task.id(), task) != null) {
                throw new IllegalArgumentException("Duplicate task id: " + task.id());
            }
        }
        return byId;
    }

    /**
     * Depth-first search restricted to tasks Kahn's algorithm could not resolve.
     * Every such task has an unresolved dependency, so walking dependencies must revisit a task.
     * The walk keeps its own stack so that long dependency chains cannot overflow the thread stack.
     */
    private static List<String> findCycle(Map<String, Task> byId, Set<String> unresolved) {
        var visited = new HashSet<String>();
        for (var start : unresolved) {
            if (visited.contains(start)) continue;
            var cycle = walk(start, byId, unresolved, visited);
            if (cycle != null) {
                return cycle;
            }
        }
        // Unreachable for a consistent graph
        return List.copyOf(unresolved);
    }

    private static List<String> walk(String start, Map<String, Task> byId, Set<String> unresolved,
                                     Set<String> visited) {
        var path = new ArrayList<String>();
        var onPath = new HashMap<String, Integer>();
        var frames = new ArrayDeque<Iterator<String>>();

        enter(start, byId, visited, path, onPath, frames);
        while (!frames.isEmpty()) {
            var deps = frames.peek();
            if (!deps.hasNext()) {
                frames.pop();
                onPath.remove(path.remove(path.size() - 1));
                continue;
            }
            var dep = deps.next();
            if (!unresolved.contains(dep)) continue;
            Integer index = onPath.get(dep);
            if (index != null) {
                var cycle = new ArrayList<>(path.subList(index, path.size()));
                cycle.add(dep);
                return cycle;
            }
            if (!visited.contains(dep)) {
                enter(dep, byId, visited, path, onPath, frames);
            }
        }
        return null;
    }

    private static void enter(String id, Map<String, Task> byId, Set<String> visited, List<String> path,
                              Map<String, Integer> onPath, ArrayDeque<Iterator<String>> frames) {
        onPath.put(id, path.size());
        path.add(id);
        visited.add(id);
        frames.push(new TreeSet<>(byId.get(id).dependencies()).iterator());
    }
}
