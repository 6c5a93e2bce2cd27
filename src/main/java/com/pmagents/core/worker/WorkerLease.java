package com.pmagents.core.worker;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An acquired capability slot paired with the capability's proxy. Closing the lease
 * returns the slot; closing twice has no further effect.
 */
public class WorkerLease implements AutoCloseable {

    private final WorkerProxy proxy;
    private final CapabilitySlots slots;
    private final AtomicBoolean released = new AtomicBoolean();

    WorkerLease(WorkerProxy proxy, CapabilitySlots slots) {
        this.proxy = proxy;
        this.slots = slots;
    }

    public WorkerProxy proxy() {
        return proxy;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            slots.release();
        }
    }
}
