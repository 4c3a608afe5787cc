package com.sailfish.retrydispatch.worker;

import com.sailfish.retrydispatch.model.ExecutionRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Everything a worker is constructed with. Built through {@link #fresh} or {@link #retry}, the two call sites
 * that start a run.
 */
public final class WorkerContext {

    private final WorkerMode mode;
    private final String handlerName;
    private final ExecutionRecord execution;
    private final Set<String> recordIds;
    private final ExecutionRecord parent;

    private WorkerContext(WorkerMode mode, String handlerName, ExecutionRecord execution,
                          Collection<String> recordIds, ExecutionRecord parent) {
        this.mode = mode;
        this.handlerName = handlerName;
        this.execution = Objects.requireNonNull(execution, "execution cannot be null");
        Objects.requireNonNull(recordIds, "recordIds cannot be null");
        this.recordIds = Collections.unmodifiableSet(new LinkedHashSet<>(recordIds));
        this.parent = parent;
    }

    /**
     * Context for a brand-new run.
     *
     * @param handlerName The name the worker was resolved under.
     * @param execution The execution record of the run.
     * @param recordIds The ids of the records to deliver.
     */
    public static WorkerContext fresh(String handlerName, ExecutionRecord execution, Collection<String> recordIds) {
        return new WorkerContext(WorkerMode.FRESH, handlerName, execution, recordIds, null);
    }

    /**
     * Context for a retry attempt. The parent is kept so its outcome can be updated once the callouts are done.
     *
     * @param handlerName The name the worker was resolved under.
     * @param child The new child execution record of this attempt.
     * @param recordIds The failed ids being retried.
     * @param parent The execution being retried.
     */
    public static WorkerContext retry(String handlerName, ExecutionRecord child, Collection<String> recordIds,
                                      ExecutionRecord parent) {
        Objects.requireNonNull(parent, "parent cannot be null for a retry");
        return new WorkerContext(WorkerMode.RETRY, handlerName, child, recordIds, parent);
    }

    public WorkerMode getMode() {
        return mode;
    }

    public boolean isRetry() {
        return mode == WorkerMode.RETRY;
    }

    public String getHandlerName() {
        return handlerName;
    }

    public ExecutionRecord getExecution() {
        return execution;
    }

    public Set<String> getRecordIds() {
        return recordIds;
    }

    public Optional<ExecutionRecord> getParent() {
        return Optional.ofNullable(parent);
    }

    @Override
    public String toString() {
        return "WorkerContext{" +
               "mode=" + mode +
               ", handlerName='" + handlerName + '\'' +
               ", execution=" + execution.getId() +
               ", recordIds=" + recordIds.size() +
               ", parent=" + (parent == null ? null : parent.getId()) +
               '}';
    }
}
