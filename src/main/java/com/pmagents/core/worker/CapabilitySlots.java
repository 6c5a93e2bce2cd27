package com.pmagents.core.worker;

import com.pmagents.core.model.TaskPriority;

import java.util.Comparator;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

/**
 * Concurrency slots of one capability, handed out by task priority.
 *
 * <p>Waiters rank by priority, then by reservation order. A waiter is granted a slot once
 * fewer waiters rank ahead of it than there are free slots, so a CRITICAL task reserved
 * alongside LOW ones is served first however its dispatch thread is scheduled.
 */
final class CapabilitySlots {

    private static final Comparator<SlotReservation> RANK = Comparator
            .comparing(SlotReservation::priority)
            .thenComparingLong(SlotReservation::sequence);

    private final String capability;
    private final TreeSet<SlotReservation> waiting = new TreeSet<>(RANK);
    private int available;
    private long sequence;

    CapabilitySlots(String capability, int capacity) {
        this.capability = capability;
        this.available = capacity;
    }

    synchronized SlotReservation reserve(TaskPriority priority) {
        var reservation = new SlotReservation(capability, priority != null ? priority : TaskPriority.MEDIUM,
                sequence++, this);
        waiting.add(reservation);
        return reservation;
    }

    /**
     * Wait until the reservation is granted a slot.
     *
     * @param timeoutMs maximum wait, or a negative value to wait indefinitely
     * @return {@code false} if the timeout passed first; the reservation is then withdrawn
     */
    synchronized boolean await(SlotReservation reservation, long timeoutMs) throws InterruptedException {
        if (!waiting.contains(reservation)) {
            throw new IllegalStateException("Reservation for '" + capability + "' was already granted or withdrawn");
        }
        long deadline = timeoutMs < 0 ? 0 : System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (waiting.headSet(reservation).size() >= available) {
            try {
                if (timeoutMs < 0) {
                    wait();
                } else {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        withdraw(reservation);
                        return false;
                    }
                    TimeUnit.NANOSECONDS.timedWait(this, remaining);
                }
            } catch (InterruptedException e) {
                withdraw(reservation);
                throw e;
            }
        }
        waiting.remove(reservation);
        available--;
        return true;
    }

    synchronized void withdraw(SlotReservation reservation) {
        if (waiting.remove(reservation)) {
            notifyAll();
        }
    }

    synchronized void release() {
        available++;
        notifyAll();
    }

    synchronized int available() {
        return available;
    }
}
