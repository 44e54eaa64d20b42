package com.ryuqq.orderevents.core.spi;

import com.ryuqq.orderevents.core.contract.ChangeEvent;
import com.ryuqq.orderevents.core.model.Order;
import com.ryuqq.orderevents.core.model.OrderId;

import java.util.List;
import java.util.Optional;

/**
 * Order Store SPI: keyed order records plus a write-ahead log of change events.
 *
 * <p>The store is the only synchronization point between concurrent handler invocations.
 * {@link #commit(Order, Order, ChangeEvent)} must be an atomic, single-key conditional write.</p>
 *
 * <p><strong>Write-Ahead Pattern:</strong></p>
 * <pre>
 * 1. commit(expected, updated, change) → order replaced, change recorded PENDING
 * 2. EventBus.publish(change)
 * 3. markPublished(change)             → change no longer pending
 * </pre>
 *
 * <p>If step 2 fails, the pending change is recovered either by the handler on the next
 * re-delivery of the same event or by a periodic finalizer scan.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Full-record writes: no partial field updates</li>
 *   <li>Atomic commit: the order write and the pending entry succeed or fail together</li>
 * </ul>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public interface OrderStore {

    /**
     * Loads an order by its identifier.
     *
     * @param orderId the order identifier
     * @return the stored order, or empty if none exists
     * @throws IllegalArgumentException if orderId is null
     */
    Optional<Order> get(OrderId orderId);

    /**
     * Unconditionally writes the full order record.
     *
     * <p>Used to seed orders created by other services.</p>
     *
     * @param order the order to store
     * @throws IllegalArgumentException if order is null
     */
    void put(Order order);

    /**
     * Atomically replaces {@code expected} with {@code updated} and records {@code change} as pending.
     *
     * <p>The write succeeds only if the stored record still equals {@code expected}.</p>
     *
     * @param expected the record the transition was computed from
     * @param updated the record to write
     * @param change the change event describing the write
     * @return true if written, false if the stored record no longer matches {@code expected}
     * @throws IllegalArgumentException if any argument is null or the three do not share an orderId
     * @throws com.ryuqq.orderevents.core.exception.StoreException if the write itself fails
     */
    boolean commit(Order expected, Order updated, ChangeEvent change);

    /**
     * Returns the pending change events for one order, oldest first.
     *
     * @param orderId the order identifier
     * @return pending changes (may be empty)
     * @throws IllegalArgumentException if orderId is null
     */
    List<ChangeEvent> pendingChanges(OrderId orderId);

    /**
     * Scans pending change events across all orders, oldest first.
     *
     * @param batchSize maximum number of entries to return
     * @return pending changes (may be empty)
     * @throws IllegalArgumentException if batchSize is not positive
     */
    List<ChangeEvent> scanPending(int batchSize);

    /**
     * Marks a change event as published.
     *
     * <p>Idempotent: marking an unknown or already published change has no effect.</p>
     *
     * @param change the published change
     * @throws IllegalArgumentException if change is null
     */
    void markPublished(ChangeEvent change);
}
