package com.sailfish.retrydispatch.worker;

/**
 * A failure of a worker as a whole, as opposed to the failure of one record's callout.
 * Raised and caught inside the worker; it never reaches the dispatcher or sibling workers.
 */
public class WorkerExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient WorkerContext context;

    public WorkerExecutionException(WorkerContext context, Throwable cause) {
        super("Worker '" + context.getHandlerName() + "' (" + context.getMode() + ", execution "
              + context.getExecution().getId() + ") failed: " + describe(cause), cause);
        this.context = context;
    }

    public WorkerContext getContext() {
        return context;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
