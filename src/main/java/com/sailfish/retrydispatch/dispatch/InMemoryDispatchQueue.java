package com.sailfish.retrydispatch.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded in-process {@link DispatchQueue}. Publishing waits at most {@code offerTimeout} for space.
 */
public class InMemoryDispatchQueue implements DispatchQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDispatchQueue.class);

    public static final int DEFAULT_CAPACITY = 1_000;
    public static final Duration DEFAULT_OFFER_TIMEOUT = Duration.ofSeconds(1);

    private final BlockingQueue<DispatchMessage> messages;
    private final int capacity;
    private final Duration offerTimeout;
    private final int maxMessageLength;

    public InMemoryDispatchQueue() {
        this(DEFAULT_CAPACITY, DEFAULT_OFFER_TIMEOUT, DispatchMessageChunker.DEFAULT_MAX_MESSAGE_LENGTH);
    }

    public InMemoryDispatchQueue(int capacity, Duration offerTimeout, int maxMessageLength) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.offerTimeout = Objects.requireNonNull(offerTimeout, "offerTimeout cannot be null");
        if (offerTimeout.isNegative()) {
            throw new IllegalArgumentException("offerTimeout must not be negative");
        }
        if (maxMessageLength <= 0) {
            throw new IllegalArgumentException("maxMessageLength must be positive");
        }
        this.capacity = capacity;
        this.maxMessageLength = maxMessageLength;
        this.messages = new LinkedBlockingQueue<>(capacity);
        log.info("InMemoryDispatchQueue initialized with capacity={}, offerTimeout={}, maxMessageLength={}", capacity, offerTimeout, maxMessageLength);
    }

    @Override
    public void publish(DispatchMessage message) {
        Objects.requireNonNull(message, "message cannot be null");
        if (message.length() > maxMessageLength) {
            throw new IllegalArgumentException("Dispatch message length " + message.length() + " exceeds the transport limit of " + maxMessageLength);
        }
        boolean accepted;
        try {
            accepted = messages.offer(message, offerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchQueueFullException("Interrupted while publishing " + message, e);
        }
        if (!accepted) {
            throw new DispatchQueueFullException("Dispatch queue full (capacity " + capacity + "), could not publish " + message);
        }
        log.debug("Published {} (queue size {})", message, messages.size());
    }

    @Override
    public List<DispatchMessage> drain(int maxMessages) {
        if (maxMessages <= 0) {
            throw new IllegalArgumentException("maxMessages must be positive");
        }
        List<DispatchMessage> drained = new ArrayList<>(Math.min(maxMessages, messages.size()));
        messages.drainTo(drained, maxMessages);
        return drained;
    }

    @Override
    public int size() {
        return messages.size();
    }

    public int getCapacity() { return capacity; }
}
