package com.sailfish.retrydispatch.budget;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Semaphore;

/**
 * A {@link DispatchBudget} backed by a non-fair {@link Semaphore}.
 */
public class SemaphoreDispatchBudget implements DispatchBudget {

    private static final Logger log = LoggerFactory.getLogger(SemaphoreDispatchBudget.class);

    public static final int DEFAULT_CAPACITY = 50;

    private final int capacity;
    private final Semaphore slots;

    public SemaphoreDispatchBudget() {
        this(DEFAULT_CAPACITY);
    }

    public SemaphoreDispatchBudget(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.slots = new Semaphore(capacity);
        log.info("DispatchBudget initialized with capacity={}", capacity);
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public int availableSlots() {
        return slots.availablePermits();
    }

    @Override
    public boolean tryAcquire() {
        return slots.tryAcquire();
    }

    @Override
    public void release() {
        // Guard against a double release pushing the budget above its capacity
        synchronized (slots) {
            if (slots.availablePermits() >= capacity) {
                log.warn("Ignoring release on a full DispatchBudget (capacity={})", capacity);
                return;
            }
            slots.release();
        }
    }

    @Override
    public String toString() {
        return "SemaphoreDispatchBudget{capacity=" + capacity + ", available=" + slots.availablePermits() + '}';
    }
}
