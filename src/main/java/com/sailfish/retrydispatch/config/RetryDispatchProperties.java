package com.sailfish.retrydispatch.config;

import com.sailfish.retrydispatch.budget.SemaphoreDispatchBudget;
import com.sailfish.retrydispatch.dispatch.DispatchMessageChunker;
import com.sailfish.retrydispatch.dispatch.InMemoryDispatchQueue;
import com.sailfish.retrydispatch.service.impl.DispatchQueueConsumer;
import com.sailfish.retrydispatch.service.impl.RetrySelectionScheduler;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the retry dispatch engine, bound to the {@code retry.dispatch} prefix.
 *
 * <pre>{@code
 * retry:
 *   dispatch:
 *     budget:
 *       max-concurrent-workers: 50
 *     transport:
 *       max-message-length: 131072
 *       max-ids-per-message: 2000
 *     queue:
 *       capacity: 1000
 *       offer-timeout: 1s
 *     selection:
 *       enabled: true
 *       interval: 15m
 *     consumer:
 *       enabled: true
 *       poll-interval: 5s
 *       max-messages-per-cycle: 10
 * }</pre>
 *
 * @see RetryDispatchAutoConfiguration
 */
@ConfigurationProperties(prefix = "retry.dispatch")
public class RetryDispatchProperties {

    public static final int DEFAULT_SCHEDULER_THREADS = 2;

    private int schedulerThreads = DEFAULT_SCHEDULER_THREADS;
    private BudgetConfig budget = new BudgetConfig();
    private TransportConfig transport = new TransportConfig();
    private QueueConfig queue = new QueueConfig();
    private SelectionConfig selection = new SelectionConfig();
    private ConsumerConfig consumer = new ConsumerConfig();

    public int getSchedulerThreads() { return schedulerThreads; }
    public void setSchedulerThreads(int schedulerThreads) { this.schedulerThreads = schedulerThreads; }

    public BudgetConfig getBudget() { return budget; }
    public void setBudget(BudgetConfig budget) { this.budget = budget; }

    public TransportConfig getTransport() { return transport; }
    public void setTransport(TransportConfig transport) { this.transport = transport; }

    public QueueConfig getQueue() { return queue; }
    public void setQueue(QueueConfig queue) { this.queue = queue; }

    public SelectionConfig getSelection() { return selection; }
    public void setSelection(SelectionConfig selection) { this.selection = selection; }

    public ConsumerConfig getConsumer() { return consumer; }
    public void setConsumer(ConsumerConfig consumer) { this.consumer = consumer; }

    /** Worker concurrency budget. */
    public static class BudgetConfig {
        private int maxConcurrentWorkers = SemaphoreDispatchBudget.DEFAULT_CAPACITY;

        public int getMaxConcurrentWorkers() { return maxConcurrentWorkers; }
        public void setMaxConcurrentWorkers(int maxConcurrentWorkers) { this.maxConcurrentWorkers = maxConcurrentWorkers; }
    }

    /** Size limits of a single dispatch message. */
    public static class TransportConfig {
        private int maxMessageLength = DispatchMessageChunker.DEFAULT_MAX_MESSAGE_LENGTH;
        private int maxIdsPerMessage = DispatchMessageChunker.DEFAULT_MAX_IDS_PER_MESSAGE;

        public int getMaxMessageLength() { return maxMessageLength; }
        public void setMaxMessageLength(int maxMessageLength) { this.maxMessageLength = maxMessageLength; }

        public int getMaxIdsPerMessage() { return maxIdsPerMessage; }
        public void setMaxIdsPerMessage(int maxIdsPerMessage) { this.maxIdsPerMessage = maxIdsPerMessage; }
    }

    /** In-memory dispatch queue. */
    public static class QueueConfig {
        private int capacity = InMemoryDispatchQueue.DEFAULT_CAPACITY;
        private Duration offerTimeout = InMemoryDispatchQueue.DEFAULT_OFFER_TIMEOUT;

        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }

        public Duration getOfferTimeout() { return offerTimeout; }
        public void setOfferTimeout(Duration offerTimeout) { this.offerTimeout = offerTimeout; }
    }

    /**
     * Periodic candidate selection. Off by default so that embedding applications opt in explicitly.
     */
    public static class SelectionConfig {
        private boolean enabled = false;
        private Duration interval = RetrySelectionScheduler.DEFAULT_SELECTION_INTERVAL;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
    }

    /** Dispatch queue consumer. */
    public static class ConsumerConfig {
        private boolean enabled = false;
        private Duration pollInterval = DispatchQueueConsumer.DEFAULT_POLL_INTERVAL;
        private int maxMessagesPerCycle = DispatchQueueConsumer.DEFAULT_MAX_MESSAGES_PER_CYCLE;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }

        public int getMaxMessagesPerCycle() { return maxMessagesPerCycle; }
        public void setMaxMessagesPerCycle(int maxMessagesPerCycle) { this.maxMessagesPerCycle = maxMessagesPerCycle; }
    }
}
