package com.sailfish.retrydispatch.service.impl;

import com.sailfish.retrydispatch.dispatch.CandidateSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Service responsible for periodically selecting retry candidates and publishing them for dispatch.
 * With the default interval this fires four times an hour.
 */
public class RetrySelectionScheduler {

    private static final Logger log = LoggerFactory.getLogger(RetrySelectionScheduler.class);

    public static final Duration DEFAULT_SELECTION_INTERVAL = Duration.ofMinutes(15);

    private final CandidateSelector candidateSelector;
    private final ScheduledExecutorService schedulerExecutor;
    private final Duration selectionInterval;

    private ScheduledFuture<?> scheduledTask;

    public RetrySelectionScheduler(CandidateSelector candidateSelector, ScheduledExecutorService schedulerExecutor) {
        this(candidateSelector, schedulerExecutor, DEFAULT_SELECTION_INTERVAL);
    }

    public RetrySelectionScheduler(CandidateSelector candidateSelector,
                                   ScheduledExecutorService schedulerExecutor,
                                   Duration selectionInterval) {
        this.candidateSelector = Objects.requireNonNull(candidateSelector, "candidateSelector cannot be null");
        this.schedulerExecutor = Objects.requireNonNull(schedulerExecutor, "schedulerExecutor cannot be null");
        this.selectionInterval = Objects.requireNonNull(selectionInterval, "selectionInterval cannot be null");
        if (selectionInterval.isNegative() || selectionInterval.isZero()) {
            throw new IllegalArgumentException("selectionInterval must be positive");
        }
        log.info("RetrySelectionScheduler initialized with selectionInterval={}", selectionInterval);
    }

    @PostConstruct
    public synchronized void start() {
        log.info("Starting RetrySelectionScheduler...");
        if (schedulerExecutor.isShutdown() || schedulerExecutor.isTerminated()) {
            log.error("Cannot start RetrySelectionScheduler: schedulerExecutor is shut down or terminated.");
            return;
        }
        if (scheduledTask != null && !scheduledTask.isDone()) {
            log.warn("RetrySelectionScheduler already started.");
            return;
        }
        // Fixed rate keeps the ticks aligned to the interval regardless of how long a selection takes
        scheduledTask = schedulerExecutor.scheduleAtFixedRate(
                this::runSelectionCycle,
                selectionInterval.toMillis(),
                selectionInterval.toMillis(),
                TimeUnit.MILLISECONDS
        );
        log.info("RetrySelectionScheduler started. Selecting candidates every {}", selectionInterval);
    }

    @PreDestroy
    public synchronized void stop() {
        log.info("Stopping RetrySelectionScheduler...");
        if (scheduledTask != null && !scheduledTask.isDone()) {
            scheduledTask.cancel(false);
        }
        log.info("RetrySelectionScheduler stopped.");
    }

    /**
     * Runs one selection. Never throws, so the periodic task is not cancelled by a failing cycle.
     */
    void runSelectionCycle() {
        log.debug("Running retry selection cycle...");
        try {
            int published = candidateSelector.publishCandidates();
            log.debug("Retry selection cycle published {} messages.", published);
        } catch (Exception e) {
            log.error("Error during retry selection cycle: {}", e.getMessage(), e);
        }
    }

    public Duration getSelectionInterval() { return selectionInterval; }
}
