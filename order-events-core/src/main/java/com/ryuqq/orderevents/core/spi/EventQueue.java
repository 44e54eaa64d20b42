package com.ryuqq.orderevents.core.spi;

import com.ryuqq.orderevents.core.contract.DomainEvent;

import java.util.List;

/**
 * Inbound event queue SPI used by the delivery runner.
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Idempotent: ack/nack/deadLetter of a delivery no longer in flight has no effect</li>
 *   <li>At-least-once Delivery: events may be delivered multiple times</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * for (Delivery delivery : queue.dequeue(10)) {
 *     HandlingOutcome outcome = handler.handle(delivery.event());
 *     if (outcome.isRetry()) {
 *         queue.nack(delivery, backoffMs);
 *     } else {
 *         queue.ack(delivery);
 *     }
 * }
 * </pre>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public interface EventQueue {

    /**
     * Enqueues an inbound event.
     *
     * @param event the event
     * @param delayMs delay before the event becomes visible (0 for immediate)
     * @throws IllegalArgumentException if event is null or delayMs is negative
     */
    void publish(DomainEvent event, long delayMs);

    /**
     * Takes up to {@code batchSize} visible deliveries and marks them in flight.
     *
     * @param batchSize maximum number of deliveries
     * @return deliveries (may be empty)
     * @throws IllegalArgumentException if batchSize is not positive
     */
    List<Delivery> dequeue(int batchSize);

    /**
     * Removes a delivery permanently.
     *
     * @param delivery the processed delivery
     * @throws IllegalArgumentException if delivery is null
     */
    void ack(Delivery delivery);

    /**
     * Returns a delivery to the queue for another attempt.
     *
     * @param delivery the delivery to retry
     * @param delayMs delay before redelivery (0 for immediate)
     * @throws IllegalArgumentException if delivery is null or delayMs is negative
     */
    void nack(Delivery delivery, long delayMs);

    /**
     * Moves a delivery to the dead-letter queue.
     *
     * @param delivery the permanently failed delivery
     * @param reason failure description
     * @throws IllegalArgumentException if delivery or reason is null
     */
    void deadLetter(Delivery delivery, String reason);
}
