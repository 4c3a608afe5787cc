package com.sailfish.retrydispatch.worker;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * What a worker achieved once all its callouts have returned.
 */
public final class WorkerOutcome {

    private final Set<String> succeededIds;
    private final Map<String, String> failures;
    private final Integer lastStatusCode;

    private WorkerOutcome(Builder builder) {
        this.succeededIds = Collections.unmodifiableSet(new LinkedHashSet<>(builder.succeededIds));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(builder.failures));
        this.lastStatusCode = builder.lastStatusCode;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * An outcome in which every id failed with the same error.
     */
    public static WorkerOutcome allFailed(Collection<String> ids, String error) {
        Builder builder = builder();
        for (String id : ids) {
            builder.failed(id, error, null);
        }
        return builder.build();
    }

    public boolean isSuccess() {
        return failures.isEmpty();
    }

    public Set<String> getSucceededIds() {
        return succeededIds;
    }

    /**
     * @return The failed ids in processing order.
     */
    public Set<String> getFailedIds() {
        return failures.keySet();
    }

    public Map<String, String> getFailures() {
        return failures;
    }

    /**
     * @return The status code of the last failed exchange, or of the last exchange when nothing failed.
     */
    public Integer getLastStatusCode() {
        return lastStatusCode;
    }

    public String firstError() {
        return failures.isEmpty() ? null : failures.values().iterator().next();
    }

    @Override
    public String toString() {
        return "WorkerOutcome{succeeded=" + succeededIds.size() + ", failed=" + failures.size()
               + ", lastStatusCode=" + lastStatusCode + '}';
    }

    public static final class Builder {
        private final Set<String> succeededIds = new LinkedHashSet<>();
        private final Map<String, String> failures = new LinkedHashMap<>();
        private Integer lastStatusCode;
        private boolean failedStatusSeen;

        private Builder() {
        }

        public Builder succeeded(String id, Integer statusCode) {
            succeededIds.add(id);
            failures.remove(id);
            if (!failedStatusSeen && statusCode != null) {
                lastStatusCode = statusCode;
            }
            return this;
        }

        public Builder failed(String id, String error, Integer statusCode) {
            succeededIds.remove(id);
            failures.put(id, error);
            if (statusCode != null) {
                lastStatusCode = statusCode;
                failedStatusSeen = true;
            }
            return this;
        }

        public WorkerOutcome build() {
            return new WorkerOutcome(this);
        }
    }
}
