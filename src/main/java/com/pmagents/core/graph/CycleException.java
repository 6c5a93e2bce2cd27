package com.pmagents.core.graph;

import java.util.List;

/**
 * The dependency relation contains a cycle.
 */
public class CycleException extends GraphValidationException {

    private final List<String> cycle;

    /**
     * @param cycle offending id sequence, with the first id repeated at the end
     */
    public CycleException(List<String> cycle) {
        super(cycle.isEmpty() ? null : cycle.get(0),
                "Dependency cycle detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
