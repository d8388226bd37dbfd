package com.netcourier.rag.service.queue;

import java.util.List;

/**
 * At-least-once work queue. A delivery that is neither acknowledged nor returned stays in flight; a
 * message returned after its final permitted receive moves to the dead-letter queue.
 */
public interface ChunkWorkQueue {

    void send(ChunkWorkItem item);

    List<QueueDelivery> receive(int maxMessages);

    void ack(QueueDelivery delivery);

    void nack(QueueDelivery delivery);

    List<ChunkWorkItem> pollDeadLetters(int maxMessages);
}
