package com.ryuqq.orderevents.core.spi;

import com.ryuqq.orderevents.core.contract.ChangeEvent;

/**
 * Outbound event bus SPI for order change notifications.
 *
 * <p>Delivery is at-least-once: consumers must tolerate duplicates.</p>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public interface EventBus {

    /**
     * Publishes a change event.
     *
     * @param event the change event
     * @throws IllegalArgumentException if event is null
     * @throws RuntimeException if the bus rejects the event or is unreachable
     */
    void publish(ChangeEvent event);
}
