package com.ryuqq.orderevents.adapter.inmemory.queue;

import com.ryuqq.orderevents.core.contract.DomainEvent;
import com.ryuqq.orderevents.core.spi.Delivery;
import com.ryuqq.orderevents.core.spi.EventQueue;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link EventQueue} SPI for testing and reference purposes.
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Main Queue:</strong> DelayQueue&lt;DelayedDelivery&gt; - Delayed delivery ordered by availability time</li>
 *   <li><strong>In-Flight Tracking:</strong> ConcurrentHashMap&lt;String, InFlight&gt; - Visibility timeout per delivery id</li>
 *   <li><strong>Dead Letter Queue:</strong> CopyOnWriteArrayList&lt;DeadLetter&gt; - Permanently failed deliveries</li>
 * </ul>
 *
 * <p>A redelivery (nack or visibility timeout) keeps the delivery id and increments the attempt.</p>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public class InMemoryEventQueue implements EventQueue {

    /**
     * Default visibility timeout: 30 seconds.
     */
    private static final long DEFAULT_VISIBILITY_TIMEOUT_MS = 30_000L;

    private final DelayQueue<DelayedDelivery> queue;
    private final ConcurrentHashMap<String, InFlight> inFlight;
    private final List<DeadLetter> deadLetters;
    private final AtomicLong sequence;
    private final long visibilityTimeoutMs;

    /**
     * Creates a queue with default visibility timeout (30 seconds).
     */
    public InMemoryEventQueue() {
        this(DEFAULT_VISIBILITY_TIMEOUT_MS);
    }

    /**
     * Creates a queue with custom visibility timeout.
     *
     * @param visibilityTimeoutMs visibility timeout in milliseconds
     * @throws IllegalArgumentException if visibilityTimeoutMs is not positive
     */
    public InMemoryEventQueue(long visibilityTimeoutMs) {
        if (visibilityTimeoutMs <= 0) {
            throw new IllegalArgumentException("visibilityTimeoutMs must be positive, but was: " + visibilityTimeoutMs);
        }
        this.queue = new DelayQueue<>();
        this.inFlight = new ConcurrentHashMap<>();
        this.deadLetters = new CopyOnWriteArrayList<>();
        this.sequence = new AtomicLong();
        this.visibilityTimeoutMs = visibilityTimeoutMs;
    }

    @Override
    public void publish(DomainEvent event, long delayMs) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative, but was: " + delayMs);
        }
        enqueue(new Delivery(UUID.randomUUID().toString(), event, 1), delayMs);
    }

    @Override
    public List<Delivery> dequeue(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }

        List<Delivery> result = new ArrayList<>();
        long now = System.currentTimeMillis();

        for (int i = 0; i < batchSize; i++) {
            DelayedDelivery delayed = queue.poll();
            if (delayed == null) {
                break;
            }
            Delivery delivery = delayed.delivery;
            inFlight.put(delivery.deliveryId(), new InFlight(delivery, now + visibilityTimeoutMs));
            result.add(delivery);
        }

        return result;
    }

    @Override
    public void ack(Delivery delivery) {
        if (delivery == null) {
            throw new IllegalArgumentException("delivery cannot be null");
        }
        inFlight.remove(delivery.deliveryId());
    }

    /**
     * {@inheritDoc}
     *
     * <p>A delivery that is no longer in flight is left alone.</p>
     */
    @Override
    public void nack(Delivery delivery, long delayMs) {
        if (delivery == null) {
            throw new IllegalArgumentException("delivery cannot be null");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative, but was: " + delayMs);
        }
        InFlight entry = inFlight.remove(delivery.deliveryId());
        if (entry != null) {
            enqueue(entry.delivery.nextAttempt(), delayMs);
        }
    }

    @Override
    public void deadLetter(Delivery delivery, String reason) {
        if (delivery == null) {
            throw new IllegalArgumentException("delivery cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        inFlight.remove(delivery.deliveryId());
        deadLetters.add(new DeadLetter(delivery, reason, System.currentTimeMillis()));
    }

    /**
     * Returns in-flight deliveries whose visibility timeout has expired to the queue.
     *
     * @return number of deliveries returned to queue
     */
    public int processVisibilityTimeouts() {
        long now = System.currentTimeMillis();
        int count = 0;

        List<String> expired = new ArrayList<>();
        for (var entry : inFlight.entrySet()) {
            if (entry.getValue().visibleAt <= now) {
                expired.add(entry.getKey());
            }
        }

        for (String deliveryId : expired) {
            InFlight entry = inFlight.remove(deliveryId);
            if (entry != null) {
                enqueue(entry.delivery.nextAttempt(), 0);
                count++;
            }
        }
        return count;
    }

    private void enqueue(Delivery delivery, long delayMs) {
        queue.put(new DelayedDelivery(delivery, System.currentTimeMillis() + delayMs, sequence.incrementAndGet()));
    }

    /**
     * Clears queue, in-flight and dead letters. Used for test cleanup.
     */
    public void clear() {
        queue.clear();
        inFlight.clear();
        deadLetters.clear();
    }

    public int queueSize() {
        return queue.size();
    }

    public int inFlightSize() {
        return inFlight.size();
    }

    /**
     * Returns all dead-letter entries, oldest first. Used for test assertions.
     *
     * @return snapshot of dead letters
     */
    public List<DeadLetter> getDeadLetters() {
        return new ArrayList<>(deadLetters);
    }

    /**
     * Delivery waiting in the main queue.
     *
     * <p>Ordered by availability time, then by enqueue sequence so equal times stay FIFO.</p>
     */
    private static final class DelayedDelivery implements Delayed {
        private final Delivery delivery;
        private final long availableAt;
        private final long seq;

        DelayedDelivery(Delivery delivery, long availableAt, long seq) {
            this.delivery = delivery;
            this.availableAt = availableAt;
            this.seq = seq;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(availableAt - System.currentTimeMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            DelayedDelivery that = (DelayedDelivery) other;
            int byTime = Long.compare(availableAt, that.availableAt);
            return byTime != 0 ? byTime : Long.compare(seq, that.seq);
        }
    }

    private static final class InFlight {
        private final Delivery delivery;
        private final long visibleAt;

        InFlight(Delivery delivery, long visibleAt) {
            this.delivery = delivery;
            this.visibleAt = visibleAt;
        }
    }

    /**
     * Dead-letter entry with failure reason.
     *
     * @param delivery the failed delivery
     * @param reason failure description
     * @param timestamp when the delivery was dead-lettered
     */
    public record DeadLetter(Delivery delivery, String reason, long timestamp) {
    }
}
