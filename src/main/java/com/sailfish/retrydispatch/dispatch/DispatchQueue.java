package com.sailfish.retrydispatch.dispatch;

import java.util.List;

/**
 * The single ingress for dispatch messages. Both the candidate selector and the overflow republisher
 * publish here; the dispatch consumer drains it.
 */
public interface DispatchQueue {

    /**
     * Enqueues a message.
     *
     * @param message The message to enqueue.
     * @throws DispatchQueueFullException if the queue cannot accept the message.
     * @throws IllegalArgumentException if the message exceeds the transport's size limit.
     */
    void publish(DispatchMessage message);

    /**
     * Removes and returns up to {@code maxMessages} messages without waiting.
     *
     * @param maxMessages The maximum number of messages to return.
     * @return The drained messages in publication order, possibly empty.
     */
    List<DispatchMessage> drain(int maxMessages);

    int size();

}
