package com.netcourier.rag.service.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netcourier.rag.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryChunkWorkQueueTest {

    private final InMemoryChunkWorkQueue queue = new InMemoryChunkWorkQueue(new ObjectMapper(), 3);

    @Test
    void deliversInSendOrderAndForgetsAcknowledgedMessages() {
        queue.send(item("c-1", 0));
        queue.send(item("c-2", 1));

        List<QueueDelivery> deliveries = queue.receive(10);

        assertThat(deliveries).extracting(delivery -> delivery.item().chunkId()).containsExactly("c-1", "c-2");
        assertThat(deliveries.get(0).item()).isEqualTo(item("c-1", 0));
        assertThat(deliveries).allSatisfy(delivery -> assertThat(delivery.receiveCount()).isEqualTo(1));

        deliveries.forEach(queue::ack);
        assertThat(queue.pending()).isZero();
        assertThat(queue.receive(10)).isEmpty();
    }

    @Test
    void receiveHonoursBatchLimit() {
        for (int i = 0; i < 5; i++) {
            queue.send(item("c-" + i, i));
        }

        assertThat(queue.receive(2)).hasSize(2);
        assertThat(queue.pending()).isEqualTo(5);
    }

    @Test
    void unacknowledgedMessagesStayInFlight() {
        queue.send(item("c-1", 0));

        queue.receive(1);

        assertThat(queue.receive(1)).isEmpty();
        assertThat(queue.pending()).isEqualTo(1);
    }

    @Test
    void movesToDeadLettersAfterMaxReceives() {
        queue.send(item("c-1", 0));

        for (int attempt = 1; attempt <= 3; attempt++) {
            List<QueueDelivery> deliveries = queue.receive(1);
            int expected = attempt;
            assertThat(deliveries).singleElement()
                    .satisfies(delivery -> assertThat(delivery.receiveCount()).isEqualTo(expected));
            queue.nack(deliveries.get(0));
        }

        assertThat(queue.receive(1)).isEmpty();
        assertThat(queue.pending()).isZero();
        assertThat(queue.pollDeadLetters(10)).extracting(ChunkWorkItem::chunkId).containsExactly("c-1");
        assertThat(queue.pollDeadLetters(10)).isEmpty();
    }

    @Test
    void redeliversMessagesLeftInFlightPastTheVisibilityTimeout() {
        MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        InMemoryChunkWorkQueue timed = new InMemoryChunkWorkQueue(new ObjectMapper(), 3, Duration.ofMinutes(5), clock);
        timed.send(item("c-1", 0));
        QueueDelivery abandoned = timed.receive(1).get(0);

        clock.advance(Duration.ofMinutes(4));
        assertThat(timed.receive(1)).isEmpty();

        clock.advance(Duration.ofMinutes(2));
        List<QueueDelivery> redelivered = timed.receive(1);

        assertThat(redelivered).singleElement().satisfies(delivery -> {
            assertThat(delivery.item().chunkId()).isEqualTo("c-1");
            assertThat(delivery.receiveCount()).isEqualTo(2);
            assertThat(delivery.receiptHandle()).isNotEqualTo(abandoned.receiptHandle());
        });
        timed.ack(abandoned);
        assertThat(timed.inFlight()).isEqualTo(1);
    }

    @Test
    void deadLettersMessagesThatKeepTimingOut() {
        MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        InMemoryChunkWorkQueue timed = new InMemoryChunkWorkQueue(new ObjectMapper(), 2, Duration.ofSeconds(30), clock);
        timed.send(item("c-1", 0));

        assertThat(timed.receive(1)).hasSize(1);
        clock.advance(Duration.ofMinutes(1));
        assertThat(timed.receive(1)).hasSize(1);
        clock.advance(Duration.ofMinutes(1));

        assertThat(timed.receive(1)).isEmpty();
        assertThat(timed.pending()).isZero();
        assertThat(timed.pollDeadLetters(10)).extracting(ChunkWorkItem::chunkId).containsExactly("c-1");
    }

    private static ChunkWorkItem item(String chunkId, int sequence) {
        return new ChunkWorkItem("doc-1", 1, chunkId, sequence, "text " + chunkId, sequence * 10, sequence * 10 + 9);
    }
}
