package com.sailfish.retrydispatch.model;

import jakarta.persistence.*;
import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One run of an integration, either the original run or a retry attempt of it.
 */
@Entity
@Table(name = "execution_records", indexes = {
    @Index(name = "idx_execution_policy_status", columnList = "policy_id, status, lastAttemptAt")
})
public class ExecutionRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "policy_id", nullable = false)
    private IntegrationPolicy policy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RecordKind kind = RecordKind.EGRESS;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ExecutionStatus status;

    @Lob
    @Convert(converter = RecordIdSetConverter.class)
    private Set<String> retryIds = new LinkedHashSet<>(); // Failed record ids still to be delivered

    @Column(nullable = false)
    private int retriesAttempted = 0;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "retry_from_id")
    private ExecutionRecord retryFrom;

    @Column(nullable = true)
    private Integer lastStatusCode;

    @Column(nullable = true, length = 2000)
    private String lastError;

    @Column(nullable = true)
    private LocalDateTime lastAttemptAt;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Creates the in-memory child record for a retry attempt of {@code parent}.
     * The child inherits the parent's policy and is not persisted here.
     */
    public static ExecutionRecord newRetryChild(ExecutionRecord parent) {
        Objects.requireNonNull(parent, "parent cannot be null");
        ExecutionRecord child = new ExecutionRecord();
        child.setPolicy(parent.getPolicy());
        child.setKind(RecordKind.EGRESS_CHILD);
        child.setStatus(ExecutionStatus.PENDING);
        child.setRetryFrom(parent);
        return child;
    }

    /**
     * Creates an unmanaged copy with the same id and state. The retry id set is copied, the policy and
     * parent links are shared.
     */
    public static ExecutionRecord copyOf(ExecutionRecord source) {
        Objects.requireNonNull(source, "source cannot be null");
        ExecutionRecord copy = new ExecutionRecord();
        copy.id = source.id;
        copy.policy = source.policy;
        copy.kind = source.kind;
        copy.status = source.status;
        copy.setRetryIds(source.getRetryIds());
        copy.retriesAttempted = source.retriesAttempted;
        copy.retryFrom = source.retryFrom;
        copy.lastStatusCode = source.lastStatusCode;
        copy.lastError = source.lastError;
        copy.lastAttemptAt = source.lastAttemptAt;
        copy.createdAt = source.createdAt;
        copy.updatedAt = source.updatedAt;
        return copy;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = updatedAt = LocalDateTime.now();
        if (status == null) {
            status = ExecutionStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean hasRetryIds() {
        return retryIds != null && !retryIds.isEmpty();
    }

    public int incrementRetriesAttempted() {
        return ++retriesAttempted;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public IntegrationPolicy getPolicy() {
        return policy;
    }

    public void setPolicy(IntegrationPolicy policy) {
        this.policy = policy;
    }

    public RecordKind getKind() {
        return kind;
    }

    public void setKind(RecordKind kind) {
        this.kind = kind;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public void setStatus(ExecutionStatus status) {
        this.status = status;
    }

    public Set<String> getRetryIds() {
        return retryIds;
    }

    public void setRetryIds(Collection<String> retryIds) {
        this.retryIds = retryIds == null ? new LinkedHashSet<>() : new LinkedHashSet<>(retryIds);
    }

    public int getRetriesAttempted() {
        return retriesAttempted;
    }

    public void setRetriesAttempted(int retriesAttempted) {
        this.retriesAttempted = retriesAttempted;
    }

    public ExecutionRecord getRetryFrom() {
        return retryFrom;
    }

    public void setRetryFrom(ExecutionRecord retryFrom) {
        this.retryFrom = retryFrom;
    }

    public Integer getLastStatusCode() {
        return lastStatusCode;
    }

    public void setLastStatusCode(Integer lastStatusCode) {
        this.lastStatusCode = lastStatusCode;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public LocalDateTime getLastAttemptAt() {
        return lastAttemptAt;
    }

    public void setLastAttemptAt(LocalDateTime lastAttemptAt) {
        this.lastAttemptAt = lastAttemptAt;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionRecord that = (ExecutionRecord) o;
        return id != null && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "ExecutionRecord{" +
               "id=" + id +
               ", kind=" + kind +
               ", status=" + status +
               ", retryIds=" + (retryIds == null ? 0 : retryIds.size()) +
               ", retriesAttempted=" + retriesAttempted +
               ", retryFrom=" + (retryFrom == null ? null : retryFrom.getId()) +
               ", lastStatusCode=" + lastStatusCode +
               ", lastAttemptAt=" + lastAttemptAt +
               '}';
    }
}
