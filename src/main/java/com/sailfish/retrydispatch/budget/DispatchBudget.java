package com.sailfish.retrydispatch.budget;

/**
 * Process-wide gate on the number of workers that may be scheduled at the same time.
 * A slot is taken before a worker is scheduled and given back when that worker finishes.
 */
public interface DispatchBudget {

    /**
     * @return The fixed maximum number of slots.
     */
    int capacity();

    /**
     * @return The number of slots free right now. May be stale as soon as it is returned.
     */
    int availableSlots();

    /**
     * Takes one slot if one is free. Never blocks.
     *
     * @return true if a slot was taken, false if the budget is exhausted.
     */
    boolean tryAcquire();

    /**
     * Returns one previously acquired slot.
     */
    void release();

}
