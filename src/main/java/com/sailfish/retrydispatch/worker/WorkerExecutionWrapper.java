package com.sailfish.retrydispatch.worker;

import com.sailfish.retrydispatch.RetryableWorker;
import com.sailfish.retrydispatch.budget.DispatchBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The Runnable handed to the worker executor. Runs one worker on the execution thread and gives its
 * budget slot back when the worker is done, whatever happened.
 */
public class WorkerExecutionWrapper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WorkerExecutionWrapper.class);

    private final RetryableWorker worker;
    private final DispatchBudget budget;

    public WorkerExecutionWrapper(RetryableWorker worker, DispatchBudget budget) {
        this.worker = Objects.requireNonNull(worker, "worker cannot be null");
        this.budget = Objects.requireNonNull(budget, "budget cannot be null");
    }

    @Override
    public void run() {
        WorkerContext context = worker.getContext();
        log.debug("Starting worker '{}' for execution {}", context.getHandlerName(), context.getExecution().getId());
        try {
            worker.run();
        } catch (RuntimeException e) {
            // Contract says run() does not throw; contain it so the executor thread survives
            log.error("Worker '{}' for execution {} threw: {}", context.getHandlerName(), context.getExecution().getId(), e.getMessage(), e);
        } finally {
            budget.release();
        }
    }

    public RetryableWorker getWorker() {
        return worker;
    }
}
