package com.sailfish.retrydispatch.dispatch;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Splits an ordered id sequence into dispatch messages that respect both the transport's text limit and a
 * maximum number of ids per message. Concatenating the produced messages yields the input sequence exactly.
 */
public class DispatchMessageChunker {

    public static final int DEFAULT_MAX_MESSAGE_LENGTH = 131_072;
    public static final int DEFAULT_MAX_IDS_PER_MESSAGE = 2_000;

    // Longest possible encoding of a single long id
    static final int MAX_ID_LENGTH = String.valueOf(Long.MIN_VALUE).length();

    private final int maxMessageLength;
    private final int maxIdsPerMessage;

    public DispatchMessageChunker() {
        this(DEFAULT_MAX_MESSAGE_LENGTH, DEFAULT_MAX_IDS_PER_MESSAGE);
    }

    /**
     * @param maxMessageLength Maximum encoded length of one message payload.
     * @param maxIdsPerMessage Maximum number of ids in one message.
     */
    public DispatchMessageChunker(int maxMessageLength, int maxIdsPerMessage) {
        if (maxMessageLength < MAX_ID_LENGTH) {
            throw new IllegalArgumentException("maxMessageLength must be at least " + MAX_ID_LENGTH);
        }
        if (maxIdsPerMessage <= 0) {
            throw new IllegalArgumentException("maxIdsPerMessage must be positive");
        }
        this.maxMessageLength = maxMessageLength;
        this.maxIdsPerMessage = maxIdsPerMessage;
    }

    /**
     * Lazily chunks {@code ids}. Each message is built only when the stream pulls it.
     *
     * @param ids The ids, in dispatch order. Must not contain null.
     * @return The messages, in order.
     */
    public Stream<DispatchMessage> chunk(Iterable<Long> ids) {
        Objects.requireNonNull(ids, "ids cannot be null");
        Iterator<DispatchMessage> messages = new ChunkIterator(ids.iterator());
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(messages, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    public List<DispatchMessage> chunkAll(Iterable<Long> ids) {
        return chunk(ids).collect(Collectors.toCollection(ArrayList::new));
    }

    public int getMaxMessageLength() { return maxMessageLength; }
    public int getMaxIdsPerMessage() { return maxIdsPerMessage; }

    private final class ChunkIterator implements Iterator<DispatchMessage> {

        private final Iterator<Long> source;
        private String pending;

        private ChunkIterator(Iterator<Long> source) {
            this.source = source;
        }

        @Override
        public boolean hasNext() {
            return pending != null || source.hasNext();
        }

        @Override
        public DispatchMessage next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            StringBuilder payload = new StringBuilder();
            int count = 0;
            while (count < maxIdsPerMessage && (pending != null || source.hasNext())) {
                String token = pending != null ? pending : encode(source.next());
                int needed = count == 0 ? token.length() : token.length() + DispatchMessage.DELIMITER.length();
                if (payload.length() + needed > maxMessageLength) {
                    pending = token; // Starts the next message
                    break;
                }
                pending = null;
                if (count > 0) {
                    payload.append(DispatchMessage.DELIMITER);
                }
                payload.append(token);
                count++;
            }
            return new DispatchMessage(payload.toString());
        }

        private String encode(Long id) {
            return String.valueOf(Objects.requireNonNull(id, "ids must not contain null"));
        }
    }
}
