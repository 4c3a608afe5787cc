package com.sailfish.retrydispatch.model;

import jakarta.persistence.*;
import java.io.Serializable;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Retry configuration of one integration. Read-only to the dispatch engine.
 */
@Entity
@Table(name = "integration_policies", uniqueConstraints = {
    @UniqueConstraint(name = "uk_integration_policy_name", columnNames = "name")
})
public class IntegrationPolicy implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_RETRY_INTERVAL_MINUTES = 15;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, length = 100)
    private String handlerName; // Resolved through the HandlerRegistry at dispatch time

    @Column(nullable = false)
    private int maxRetries = DEFAULT_MAX_RETRIES;

    @Column(nullable = false)
    private int retryIntervalMinutes = DEFAULT_RETRY_INTERVAL_MINUTES;

    @Convert(converter = StatusCodeSetConverter.class)
    @Column(length = 500)
    private Set<Integer> retryableStatusCodes = new TreeSet<>(); // Empty means any status code is retryable

    @Column(nullable = false)
    private boolean enabled = true;

    public IntegrationPolicy() {
    }

    public IntegrationPolicy(String name, String handlerName, int maxRetries, Duration retryInterval) {
        this.name = name;
        this.handlerName = handlerName;
        this.maxRetries = maxRetries;
        setRetryInterval(retryInterval);
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getHandlerName() {
        return handlerName;
    }

    public void setHandlerName(String handlerName) {
        this.handlerName = handlerName;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getRetryIntervalMinutes() {
        return retryIntervalMinutes;
    }

    public void setRetryIntervalMinutes(int retryIntervalMinutes) {
        this.retryIntervalMinutes = retryIntervalMinutes;
    }

    public Duration getRetryInterval() {
        return Duration.ofMinutes(retryIntervalMinutes);
    }

    public void setRetryInterval(Duration retryInterval) {
        Objects.requireNonNull(retryInterval, "retryInterval cannot be null");
        this.retryIntervalMinutes = Math.toIntExact(retryInterval.toMinutes());
    }

    public Set<Integer> getRetryableStatusCodes() {
        return retryableStatusCodes;
    }

    public void setRetryableStatusCodes(Set<Integer> retryableStatusCodes) {
        this.retryableStatusCodes = retryableStatusCodes == null ? new TreeSet<>() : new TreeSet<>(retryableStatusCodes);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IntegrationPolicy that = (IntegrationPolicy) o;
        return Objects.equals(id, that.id) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }

    @Override
    public String toString() {
        return "IntegrationPolicy{" +
               "id=" + id +
               ", name='" + name + '\'' +
               ", handlerName='" + handlerName + '\'' +
               ", maxRetries=" + maxRetries +
               ", retryIntervalMinutes=" + retryIntervalMinutes +
               ", retryableStatusCodes=" + retryableStatusCodes +
               ", enabled=" + enabled +
               '}';
    }
}
