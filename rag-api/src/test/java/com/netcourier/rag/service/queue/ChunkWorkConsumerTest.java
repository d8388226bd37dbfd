package com.netcourier.rag.service.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netcourier.rag.config.RagProperties;
import com.netcourier.rag.service.ingestion.DeliveryOutcome;
import com.netcourier.rag.service.ingestion.IngestionCoordinator;
import com.netcourier.rag.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChunkWorkConsumerTest {

    @Mock
    private IngestionCoordinator coordinator;

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
    private InMemoryChunkWorkQueue queue;
    private ChunkWorkConsumer consumer;

    @BeforeEach
    void setUp() {
        queue = new InMemoryChunkWorkQueue(new ObjectMapper(), 3);
        RagProperties properties = new RagProperties(null, null, null, null, null, null,
                new RagProperties.Queue(3, 2, Duration.ofSeconds(30), null), null, null);
        consumer = new ChunkWorkConsumer(queue, coordinator, properties, clock);
    }

    @Test
    void handsBoundedBatchesToCoordinator() {
        for (int i = 0; i < 3; i++) {
            queue.send(item("c-" + i));
        }
        when(coordinator.handleDeliveries(anyList())).thenReturn(new DeliveryOutcome(2, 0, 0, 0, false));

        assertThat(consumer.pollOnce()).isEqualTo(2);
        assertThat(consumer.isPaused()).isFalse();
    }

    @Test
    void idlesWhenQueueIsEmpty() {
        assertThat(consumer.pollOnce()).isZero();

        verify(coordinator, never()).handleDeliveries(anyList());
    }

    @Test
    void pausesAfterThrottledBatch() {
        queue.send(item("c-1"));
        queue.send(item("c-2"));
        queue.send(item("c-3"));
        when(coordinator.handleDeliveries(anyList())).thenReturn(new DeliveryOutcome(0, 0, 2, 0, true));

        consumer.pollOnce();
        assertThat(consumer.isPaused()).isTrue();
        assertThat(consumer.pollOnce()).isZero();

        clock.advance(Duration.ofSeconds(31));
        assertThat(consumer.isPaused()).isFalse();
        assertThat(consumer.pollOnce()).isEqualTo(1);
        verify(coordinator, times(2)).handleDeliveries(anyList());
    }

    @Test
    void drainsDeadLettersToCoordinator() {
        InMemoryChunkWorkQueue strict = new InMemoryChunkWorkQueue(new ObjectMapper(), 1);
        strict.send(item("c-9"));
        strict.nack(strict.receive(1).get(0));
        ChunkWorkConsumer drainer = new ChunkWorkConsumer(strict, coordinator,
                RagProperties.defaults(), clock);

        drainer.pollOnce();

        verify(coordinator).onDeadLetter(item("c-9"));
        verify(coordinator, never()).handleDeliveries(anyList());
    }

    private static ChunkWorkItem item(String chunkId) {
        return new ChunkWorkItem("doc-1", 1, chunkId, 0, "text", 0, 4);
    }
}
