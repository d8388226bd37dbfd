package com.netcourier.rag.service.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netcourier.rag.config.RagProperties;
import com.netcourier.rag.service.PipelineException;
import com.netcourier.rag.service.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Single-process queue holding JSON message bodies, with receive counting and a dead-letter queue.
 * A received message that is neither acked nor nacked within the visibility timeout becomes receivable
 * again, counting as a failed receive.
 */
@Component
public class InMemoryChunkWorkQueue implements ChunkWorkQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryChunkWorkQueue.class);

    private final ObjectMapper objectMapper;
    private final int maxReceiveCount;
    private final Duration visibilityTimeout;
    private final Clock clock;
    private final Deque<StoredMessage> ready = new ArrayDeque<>();
    private final Map<String, StoredMessage> inFlight = new LinkedHashMap<>();
    private final Deque<String> deadLetters = new ArrayDeque<>();

    @Autowired
    public InMemoryChunkWorkQueue(ObjectMapper objectMapper, RagProperties properties, Clock clock) {
        this(objectMapper, properties.queue().maxReceiveCount(), properties.queue().visibilityTimeout(), clock);
    }

    public InMemoryChunkWorkQueue(ObjectMapper objectMapper, int maxReceiveCount) {
        this(objectMapper, maxReceiveCount, Duration.ofMinutes(5), Clock.systemUTC());
    }

    public InMemoryChunkWorkQueue(ObjectMapper objectMapper, int maxReceiveCount, Duration visibilityTimeout,
                                  Clock clock) {
        this.objectMapper = objectMapper;
        this.maxReceiveCount = maxReceiveCount;
        this.visibilityTimeout = visibilityTimeout;
        this.clock = clock;
    }

    @Override
    public synchronized void send(ChunkWorkItem item) {
        ready.addLast(new StoredMessage(UUID.randomUUID().toString(), write(item), 0, null));
    }

    @Override
    public synchronized List<QueueDelivery> receive(int maxMessages) {
        releaseExpired();
        List<QueueDelivery> deliveries = new ArrayList<>();
        while (deliveries.size() < maxMessages && !ready.isEmpty()) {
            StoredMessage message = ready.pollFirst().received(clock.instant());
            String receipt = UUID.randomUUID().toString();
            inFlight.put(receipt, message);
            deliveries.add(new QueueDelivery(receipt, read(message.body()), message.receiveCount()));
        }
        return deliveries;
    }

    @Override
    public synchronized void ack(QueueDelivery delivery) {
        inFlight.remove(delivery.receiptHandle());
    }

    @Override
    public synchronized void nack(QueueDelivery delivery) {
        StoredMessage message = inFlight.remove(delivery.receiptHandle());
        if (message != null) {
            requeue(message);
        }
    }

    @Override
    public synchronized List<ChunkWorkItem> pollDeadLetters(int maxMessages) {
        List<ChunkWorkItem> items = new ArrayList<>();
        while (items.size() < maxMessages && !deadLetters.isEmpty()) {
            items.add(read(deadLetters.pollFirst()));
        }
        return items;
    }

    public synchronized int pending() {
        return ready.size() + inFlight.size();
    }

    public synchronized int inFlight() {
        return inFlight.size();
    }

    private void releaseExpired() {
        Instant cutoff = clock.instant().minus(visibilityTimeout);
        Iterator<StoredMessage> iterator = inFlight.values().iterator();
        while (iterator.hasNext()) {
            StoredMessage message = iterator.next();
            if (message.receivedAt().isAfter(cutoff)) {
                continue;
            }
            iterator.remove();
            log.warn("Message {} was not acknowledged within {}, releasing it", message.id(), visibilityTimeout);
            requeue(message);
        }
    }

    private void requeue(StoredMessage message) {
        if (message.receiveCount() >= maxReceiveCount) {
            log.warn("Message {} exhausted {} receives, moving to dead-letter queue",
                    message.id(), message.receiveCount());
            deadLetters.addLast(message.body());
        } else {
            ready.addLast(message);
        }
    }

    private String write(ChunkWorkItem item) {
        try {
            return objectMapper.writeValueAsString(item);
        } catch (JsonProcessingException e) {
            throw new PipelineException(HttpStatus.INTERNAL_SERVER_ERROR, PipelineStage.INGESTION,
                    "Unable to serialize work item for chunk " + item.chunkId(), e);
        }
    }

    private ChunkWorkItem read(String body) {
        try {
            return objectMapper.readValue(body, ChunkWorkItem.class);
        } catch (JsonProcessingException e) {
            throw new PipelineException(HttpStatus.INTERNAL_SERVER_ERROR, PipelineStage.INGESTION,
                    "Corrupt work item on queue", e);
        }
    }

    private record StoredMessage(String id, String body, int receiveCount, Instant receivedAt) {

        StoredMessage received(Instant at) {
            return new StoredMessage(id, body, receiveCount + 1, at);
        }
    }
}
