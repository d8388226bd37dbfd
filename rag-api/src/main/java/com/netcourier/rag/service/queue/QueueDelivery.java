package com.netcourier.rag.service.queue;

public record QueueDelivery(String receiptHandle, ChunkWorkItem item, int receiveCount) {
}
