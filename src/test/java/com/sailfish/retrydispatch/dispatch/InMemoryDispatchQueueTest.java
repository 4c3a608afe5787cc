package com.sailfish.retrydispatch.dispatch;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryDispatchQueueTest {

    @Test
    void drainsInPublishOrderUpToTheRequestedCount() {
        InMemoryDispatchQueue queue = new InMemoryDispatchQueue(10, Duration.ZERO, 100);
        queue.publish(new DispatchMessage("1,2"));
        queue.publish(new DispatchMessage("3"));
        queue.publish(new DispatchMessage("4,5"));

        assertThat(queue.drain(2)).extracting(DispatchMessage::getPayload).containsExactly("1,2", "3");
        assertThat(queue.size()).isEqualTo(1);
        assertThat(queue.drain(5)).extracting(DispatchMessage::getPayload).containsExactly("4,5");
        assertThat(queue.drain(5)).isEmpty();
    }

    @Test
    void refusesWhenFull() {
        InMemoryDispatchQueue queue = new InMemoryDispatchQueue(1, Duration.ZERO, 100);
        queue.publish(new DispatchMessage("1"));

        assertThatThrownBy(() -> queue.publish(new DispatchMessage("2")))
                .isInstanceOf(DispatchQueueFullException.class);
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void refusesMessagesLongerThanTheTransportLimit() {
        InMemoryDispatchQueue queue = new InMemoryDispatchQueue(10, Duration.ZERO, 5);

        assertThatThrownBy(() -> queue.publish(new DispatchMessage("123,456")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exceeds the transport limit");
        assertThat(queue.size()).isZero();
    }
}
