package com.netcourier.rag.service.ingestion;

/**
 * Tally of one batch of queue deliveries. {@code throttled} asks the consumer to back off before polling again.
 */
public record DeliveryOutcome(int indexed, int failed, int requeued, int skipped, boolean throttled) {

    public static DeliveryOutcome empty() {
        return new DeliveryOutcome(0, 0, 0, 0, false);
    }
}
