package com.sailfish.retrydispatch.service.impl;

import com.sailfish.retrydispatch.dispatch.DispatchMessage;
import com.sailfish.retrydispatch.dispatch.DispatchQueue;
import com.sailfish.retrydispatch.dispatch.DispatchResult;
import com.sailfish.retrydispatch.dispatch.RetryDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Feeds the dispatch queue into the {@link RetryDispatcher}, one batch of messages per dispatch cycle, on a
 * single scheduler thread.
 * <p>
 * A poll keeps dispatching batches until the queue is empty or a cycle produced overflow. Overflow goes back
 * onto the queue and waits for the next poll, by which time running workers may have returned budget.
 */
public class DispatchQueueConsumer {

    private static final Logger log = LoggerFactory.getLogger(DispatchQueueConsumer.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);
    public static final int DEFAULT_MAX_MESSAGES_PER_CYCLE = 10;

    private final DispatchQueue dispatchQueue;
    private final RetryDispatcher dispatcher;
    private final ScheduledExecutorService schedulerExecutor;
    private final Duration pollInterval;
    private final int maxMessagesPerCycle;

    private ScheduledFuture<?> scheduledTask;

    public DispatchQueueConsumer(DispatchQueue dispatchQueue, RetryDispatcher dispatcher, ScheduledExecutorService schedulerExecutor) {
        this(dispatchQueue, dispatcher, schedulerExecutor, DEFAULT_POLL_INTERVAL, DEFAULT_MAX_MESSAGES_PER_CYCLE);
    }

    public DispatchQueueConsumer(DispatchQueue dispatchQueue,
                                 RetryDispatcher dispatcher,
                                 ScheduledExecutorService schedulerExecutor,
                                 Duration pollInterval,
                                 int maxMessagesPerCycle) {
        this.dispatchQueue = Objects.requireNonNull(dispatchQueue, "dispatchQueue cannot be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher cannot be null");
        this.schedulerExecutor = Objects.requireNonNull(schedulerExecutor, "schedulerExecutor cannot be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (maxMessagesPerCycle <= 0) {
            throw new IllegalArgumentException("maxMessagesPerCycle must be positive");
        }
        this.maxMessagesPerCycle = maxMessagesPerCycle;
        log.info("DispatchQueueConsumer initialized with pollInterval={} and maxMessagesPerCycle={}", pollInterval, maxMessagesPerCycle);
    }

    @PostConstruct
    public synchronized void start() {
        log.info("Starting DispatchQueueConsumer...");
        if (schedulerExecutor.isShutdown() || schedulerExecutor.isTerminated()) {
            log.error("Cannot start DispatchQueueConsumer: schedulerExecutor is shut down or terminated.");
            return;
        }
        if (scheduledTask != null && !scheduledTask.isDone()) {
            log.warn("DispatchQueueConsumer already started.");
            return;
        }
        // Fixed delay: a poll never overlaps the previous one, so dispatch stays single-threaded
        scheduledTask = schedulerExecutor.scheduleWithFixedDelay(
                this::runPoll,
                pollInterval.toMillis(),
                pollInterval.toMillis(),
                TimeUnit.MILLISECONDS
        );
        log.info("DispatchQueueConsumer started. Polling every {}", pollInterval);
    }

    @PreDestroy
    public synchronized void stop() {
        log.info("Stopping DispatchQueueConsumer...");
        if (scheduledTask != null && !scheduledTask.isDone()) {
            scheduledTask.cancel(false);
        }
        log.info("DispatchQueueConsumer stopped.");
    }

    private void runPoll() {
        try {
            int cycles = drainQueue();
            if (cycles > 0) {
                log.debug("Dispatch poll ran {} cycles; {} messages left in queue.", cycles, dispatchQueue.size());
            }
        } catch (Exception e) {
            log.error("Error during dispatch poll: {}", e.getMessage(), e);
        }
    }

    /**
     * Dispatches batches until the queue is empty or a cycle overflows.
     *
     * @return The number of dispatch cycles run.
     */
    public int drainQueue() {
        int cycles = 0;
        DispatchResult result;
        do {
            result = consumeOnce();
            if (result == null) {
                break;
            }
            cycles++;
        } while (!result.hasOverflow());
        return cycles;
    }

    /**
     * Runs a single dispatch cycle over the next batch of messages.
     *
     * @return The cycle's result, or null if the queue was empty.
     */
    public DispatchResult consumeOnce() {
        List<DispatchMessage> batch = dispatchQueue.drain(maxMessagesPerCycle);
        if (batch.isEmpty()) {
            return null;
        }
        log.debug("Dispatching batch of {} messages.", batch.size());
        return dispatcher.dispatch(batch);
    }

    public Duration getPollInterval() { return pollInterval; }
    public int getMaxMessagesPerCycle() { return maxMessagesPerCycle; }
}
