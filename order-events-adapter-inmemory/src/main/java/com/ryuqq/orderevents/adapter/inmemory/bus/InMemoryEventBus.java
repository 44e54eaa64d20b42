package com.ryuqq.orderevents.adapter.inmemory.bus;

import com.ryuqq.orderevents.core.contract.ChangeEvent;
import com.ryuqq.orderevents.core.model.OrderId;
import com.ryuqq.orderevents.core.spi.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link EventBus} SPI for testing and reference purposes.
 *
 * <p>Published events are kept in publish order so tests can play the role of a bus listener.
 * Failures can be injected to exercise the pending change recovery paths.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryEventBus bus = new InMemoryEventBus("ecommerce-bus");
 * bus.failNextPublishes(1);   // next publish throws
 * ...
 * List&lt;ChangeEvent&gt; received = bus.publishedFor(orderId);
 * </pre>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    public static final String DEFAULT_BUS_NAME = "default";

    private final String name;
    private final List<ChangeEvent> published;
    private final AtomicInteger failingPublishes;

    /**
     * Creates a bus named {@value #DEFAULT_BUS_NAME}.
     */
    public InMemoryEventBus() {
        this(DEFAULT_BUS_NAME);
    }

    /**
     * Creates a bus.
     *
     * @param name bus name
     * @throws IllegalArgumentException if name is null or blank
     */
    public InMemoryEventBus(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
        this.published = new CopyOnWriteArrayList<>();
        this.failingPublishes = new AtomicInteger();
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException while publish failures are injected
     */
    @Override
    public void publish(ChangeEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (failingPublishes.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new IllegalStateException("Event bus " + name + " unavailable");
        }
        published.add(event);
        log.debug("Published {} for {} on {}", event.detailType(), event.resources(), name);
    }

    /**
     * Makes the next {@code count} publishes throw. Used for testing.
     *
     * @param count number of failing publishes
     */
    public void failNextPublishes(int count) {
        failingPublishes.set(count);
    }

    /**
     * Returns all published events in publish order.
     *
     * @return snapshot of published events
     */
    public List<ChangeEvent> published() {
        return new ArrayList<>(published);
    }

    /**
     * Returns the events published for one order, in publish order.
     *
     * @param orderId the order identifier
     * @return snapshot of matching events
     */
    public List<ChangeEvent> publishedFor(OrderId orderId) {
        List<ChangeEvent> result = new ArrayList<>();
        for (ChangeEvent event : published) {
            if (event.orderId().equals(orderId)) {
                result.add(event);
            }
        }
        return result;
    }

    /**
     * Clears published events and injected failures. Used for test cleanup.
     */
    public void clear() {
        published.clear();
        failingPublishes.set(0);
    }

    public String getName() {
        return name;
    }
}
