package com.pmagents.core.model;

/**
 * Scheduling priority of a task. Declared from most to least important.
 */
public enum TaskPriority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    /**
     * True when this priority is strictly less important than {@code floor}.
     */
    public boolean isBelow(TaskPriority floor) {
        return floor != null && this.ordinal() > floor.ordinal();
    }
}
