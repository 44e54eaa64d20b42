package com.ryuqq.orderevents.core.spi;

import com.ryuqq.orderevents.core.contract.DomainEvent;

/**
 * One delivery of an inbound event taken from an {@link EventQueue}.
 *
 * @param deliveryId identifier of this delivery, stable across redeliveries
 * @param event the inbound event
 * @param attempt 1-based delivery attempt
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public record Delivery(
    String deliveryId,
    DomainEvent event,
    int attempt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if deliveryId is blank, event is null or attempt is not positive
     */
    public Delivery {
        if (deliveryId == null || deliveryId.isBlank()) {
            throw new IllegalArgumentException("deliveryId cannot be null or blank");
        }
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive: " + attempt);
        }
    }

    /**
     * Creates the next delivery attempt of the same event.
     *
     * @return a copy with attempt incremented
     */
    public Delivery nextAttempt() {
        return new Delivery(deliveryId, event, attempt + 1);
    }
}
