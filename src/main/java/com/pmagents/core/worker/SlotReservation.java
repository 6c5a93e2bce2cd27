package com.pmagents.core.worker;

import com.pmagents.core.model.TaskPriority;

/**
 * A place in a capability's slot queue, taken before the task's dispatch thread starts.
 * Exchange it for a {@link WorkerLease} with {@link WorkerPool#acquire(SlotReservation,
 * com.pmagents.core.scheduler.RunDeadline)}, or {@link #withdraw()} it if the task will not run.
 */
public final class SlotReservation {

    private final String capability;
    private final TaskPriority priority;
    private final long sequence;
    private final CapabilitySlots slots;

    SlotReservation(String capability, TaskPriority priority, long sequence, CapabilitySlots slots) {
        this.capability = capability;
        this.priority = priority;
        this.sequence = sequence;
        this.slots = slots;
    }

    public String capability() {
        return capability;
    }

    public TaskPriority priority() {
        return priority;
    }

    long sequence() {
        return sequence;
    }

    CapabilitySlots slots() {
        return slots;
    }

    /**
     * Give up the place in the queue. No effect once the slot was granted.
     */
    public void withdraw() {
        slots.withdraw(this);
    }
}
