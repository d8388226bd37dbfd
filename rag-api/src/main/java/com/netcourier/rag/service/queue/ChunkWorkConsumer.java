package com.netcourier.rag.service.queue;

import com.netcourier.rag.config.RagProperties;
import com.netcourier.rag.service.ingestion.DeliveryOutcome;
import com.netcourier.rag.service.ingestion.IngestionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Pulls bounded batches of chunk work off the queue and hands them to the coordinator. After a throttled
 * or unavailable embedding call the consumer stops polling for {@code rag.queue.throttle-pause}.
 */
@Component
@ConditionalOnProperty(prefix = "rag.queue", name = "consumer-enabled", havingValue = "true", matchIfMissing = true)
public class ChunkWorkConsumer {

    private static final Logger log = LoggerFactory.getLogger(ChunkWorkConsumer.class);

    private final ChunkWorkQueue queue;
    private final IngestionCoordinator coordinator;
    private final RagProperties.Queue settings;
    private final Clock clock;
    private volatile Instant pausedUntil = Instant.MIN;

    public ChunkWorkConsumer(ChunkWorkQueue queue,
                             IngestionCoordinator coordinator,
                             RagProperties properties,
                             Clock clock) {
        this.queue = queue;
        this.coordinator = coordinator;
        this.settings = properties.queue();
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${rag.queue.poll-interval-ms:1000}")
    public void poll() {
        pollOnce();
    }

    /**
     * Runs one receive cycle and returns how many deliveries were handed to the coordinator.
     */
    public int pollOnce() {
        if (clock.instant().isBefore(pausedUntil)) {
            return 0;
        }
        queue.pollDeadLetters(settings.batchSize()).forEach(coordinator::onDeadLetter);

        List<QueueDelivery> deliveries = queue.receive(settings.batchSize());
        if (deliveries.isEmpty()) {
            return 0;
        }
        DeliveryOutcome outcome = coordinator.handleDeliveries(deliveries);
        log.debug("Processed {} deliveries: {}", deliveries.size(), outcome);
        if (outcome.throttled()) {
            pausedUntil = clock.instant().plus(settings.throttlePause());
            log.warn("Pausing chunk consumption until {}", pausedUntil);
        }
        return deliveries.size();
    }

    public boolean isPaused() {
        return clock.instant().isBefore(pausedUntil);
    }
}
