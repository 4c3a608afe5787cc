package com.sailfish.retrydispatch.dispatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DispatchMessageChunkerTest {

    @Test
    void splitsIntoCeilingOfCountOverLimitMessages() {
        DispatchMessageChunker chunker = new DispatchMessageChunker(DispatchMessageChunker.DEFAULT_MAX_MESSAGE_LENGTH, 2_000);
        List<Long> ids = ids(1, 4_500);

        List<DispatchMessage> messages = chunker.chunkAll(ids);

        assertThat(messages).hasSize(3);
        assertThat(messages.get(0).idCount()).isEqualTo(2_000);
        assertThat(messages.get(1).idCount()).isEqualTo(2_000);
        assertThat(messages.get(2).idCount()).isEqualTo(500);
    }

    @Test
    void concatenatedMessagesReproduceInputOrder() {
        DispatchMessageChunker chunker = new DispatchMessageChunker(64, 7);
        List<Long> ids = new ArrayList<>(ids(1, 40));
        Collections.reverse(ids);

        List<Long> reassembled = chunker.chunk(ids)
                .flatMap(message -> message.idTokens().stream())
                .map(DispatchMessage::parseId)
                .collect(Collectors.toList());

        assertThat(reassembled).containsExactlyElementsOf(ids);
    }

    @Test
    void neverExceedsTheTransportLength() {
        // Ten-digit ids: two fit in 21 characters, a third would need 32
        DispatchMessageChunker chunker = new DispatchMessageChunker(25, 100);
        List<Long> ids = ids(1_000_000_000L, 1_000_000_004L);

        List<DispatchMessage> messages = chunker.chunkAll(ids);

        assertThat(messages).extracting(DispatchMessage::getPayload)
                .containsExactly("1000000000,1000000001", "1000000002,1000000003", "1000000004");
        assertThat(messages).allSatisfy(message -> assertThat(message.length()).isLessThanOrEqualTo(25));
    }

    @Test
    void emptyInputProducesNoMessages() {
        assertThat(new DispatchMessageChunker().chunkAll(Collections.emptyList())).isEmpty();
    }

    @Test
    void buildsMessagesOnlyWhenPulled() {
        DispatchMessageChunker chunker = new DispatchMessageChunker(1_000, 3);
        Iterable<Long> endless = () -> Stream.iterate(1L, id -> id + 1).iterator();

        DispatchMessage first = chunker.chunk(endless).findFirst().orElseThrow();

        assertThat(first.getPayload()).isEqualTo("1,2,3");
    }

    @Test
    void rejectsLimitsThatCannotHoldASingleId() {
        assertThatThrownBy(() -> new DispatchMessageChunker(DispatchMessageChunker.MAX_ID_LENGTH - 1, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DispatchMessageChunker(1_000, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<Long> ids(long fromInclusive, long toInclusive) {
        return LongStream.rangeClosed(fromInclusive, toInclusive).boxed().collect(Collectors.toList());
    }
}
