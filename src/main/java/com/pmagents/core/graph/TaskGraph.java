package com.pmagents.core.graph;

import com.pmagents.core.model.Task;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * An immutable, validated set of tasks with cached concurrency levels.
 * <p>
 * Instances can only be obtained through {@link #of(Collection)}, which rejects unknown
 * dependencies and cycles, so every {@code TaskGraph} satisfies the level invariant:
 * a task's level is strictly greater than the level of each of its dependencies.
 */
public final class TaskGraph {

    private final Map<String, Task> tasks;
    private final List<List<String>> levels;
    private final Map<String, Integer> levelIndex;
    private final Map<String, List<String>> dependents;

    private TaskGraph(Map<String, Task> tasks, List<List<String>> levels) {
        this.tasks = Collections.unmodifiableMap(tasks);
        this.levels = levels;

        var index = new HashMap<String, Integer>();
        for (int i = 0; i < levels.size(); i++) {
            for (var id : levels.get(i)) {
                index.put(id, i);
            }
        }
        this.levelIndex = Collections.unmodifiableMap(index);

        var reverse = new HashMap<String, List<String>>();
        for (var task : tasks.values()) {
            for (var dep : task.dependencies()) {
                reverse.computeIfAbsent(dep, k -> new ArrayList<>()).add(task.id());
            }
        }
        reverse.values().forEach(Collections::sort);
        this.dependents = Collections.unmodifiableMap(reverse);
    }

    /**
     * Validate a task set and build its graph.
     *
     * @throws UnknownDependencyException if a dependency id is missing
     * @throws CycleException             if the dependency relation is cyclic
     */
    public static TaskGraph of(Collection<Task> tasks) {
        var levels = GraphLeveler.buildLevels(tasks);
        var byId = new LinkedHashMap<String, Task>();
        for (var task : tasks) {
            byId.put(task.id(), task);
        }
        return new TaskGraph(byId, levels);
    }

    public List<List<String>> levels() {
        return levels;
    }

    public Collection<Task> tasks() {
        return tasks.values();
    }

    public Set<String> taskIds() {
        return tasks.keySet();
    }

    public int size() {
        return tasks.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    public Task task(String id) {
        var task = tasks.get(id);
        if (task == null) {
            throw new IllegalArgumentException("Unknown task: " + id);
        }
        return task;
    }

    public int levelOf(String id) {
        var level = levelIndex.get(id);
        if (level == null) {
            throw new IllegalArgumentException("Unknown task: " + id);
        }
        return level;
    }

    /**
     * Tasks that directly depend on {@code id}, sorted.
     */
    public List<String> dependentsOf(String id) {
        return dependents.getOrDefault(id, List.of());
    }

    /**
     * Every task that directly or transitively depends on {@code id}, sorted.
     */
    public Set<String> transitiveDependents(String id) {
        var result = new TreeSet<String>();
        var queue = new ArrayDeque<>(dependentsOf(id));
        while (!queue.isEmpty()) {
            var next = queue.poll();
            if (result.add(next)) {
                queue.addAll(dependentsOf(next));
            }
        }
        return result;
    }

    public double totalEstimatedCost() {
        return tasks.values().stream().mapToDouble(Task::estimatedCost).sum();
    }

    public Set<String> capabilities() {
        var caps = new TreeSet<String>();
        tasks.values().forEach(t -> caps.add(t.capability()));
        return caps;
    }
}
