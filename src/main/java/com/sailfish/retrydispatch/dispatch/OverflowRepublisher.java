package com.sailfish.retrydispatch.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Puts candidates that a dispatch cycle could not schedule back onto the dispatch queue, re-chunked with the
 * same size limits the selector uses and in their original order.
 */
public class OverflowRepublisher {

    private static final Logger log = LoggerFactory.getLogger(OverflowRepublisher.class);

    private final DispatchMessageChunker chunker;
    private final DispatchQueue dispatchQueue;

    public OverflowRepublisher(DispatchMessageChunker chunker, DispatchQueue dispatchQueue) {
        this.chunker = Objects.requireNonNull(chunker, "chunker cannot be null");
        this.dispatchQueue = Objects.requireNonNull(dispatchQueue, "dispatchQueue cannot be null");
    }

    /**
     * @param overflowIds Undispatched candidate ids in dispatch order.
     * @return The number of messages published.
     */
    public int republish(List<Long> overflowIds) {
        Objects.requireNonNull(overflowIds, "overflowIds cannot be null");
        if (overflowIds.isEmpty()) {
            return 0;
        }

        int messages = 0;
        int idsPublished = 0;
        Iterator<DispatchMessage> chunks = chunker.chunk(overflowIds).iterator();
        while (chunks.hasNext()) {
            DispatchMessage message = chunks.next();
            try {
                dispatchQueue.publish(message);
            } catch (DispatchQueueFullException e) {
                // Unpublished records keep their retry ids in storage, so the next selection cycle finds them again
                log.error("Dispatch queue refused overflow: {} of {} ids not re-queued, they will be reselected on the next cycle. {}",
                        overflowIds.size() - idsPublished, overflowIds.size(), e.getMessage(), e);
                break;
            }
            messages++;
            idsPublished += message.idCount();
        }
        log.info("Re-queued {} overflow ids in {} messages", idsPublished, messages);
        return messages;
    }
}
