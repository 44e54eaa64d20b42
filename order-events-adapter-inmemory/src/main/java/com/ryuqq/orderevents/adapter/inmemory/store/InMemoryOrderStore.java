package com.ryuqq.orderevents.adapter.inmemory.store;

import com.ryuqq.orderevents.core.contract.ChangeEvent;
import com.ryuqq.orderevents.core.exception.StoreException;
import com.ryuqq.orderevents.core.model.Order;
import com.ryuqq.orderevents.core.model.OrderId;
import com.ryuqq.orderevents.core.spi.OrderStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link OrderStore} SPI for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>orders:</strong> ConcurrentHashMap&lt;OrderId, Order&gt; - Full order records</li>
 *   <li><strong>pending:</strong> ConcurrentSkipListMap&lt;Long, ChangeEvent&gt; - Pending change log keyed by commit sequence</li>
 *   <li><strong>sequenceByEventId:</strong> ConcurrentHashMap&lt;String, Long&gt; - Pending entry lookup by event id</li>
 * </ul>
 *
 * <p>{@link #commit(Order, Order, ChangeEvent)} runs inside {@link ConcurrentHashMap#compute}, so the
 * compare, the write and the pending entry are atomic per order. The pending log is ordered by a
 * monotonically increasing sequence instead of wall-clock time.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public class InMemoryOrderStore implements OrderStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryOrderStore.class);

    public static final String DEFAULT_TABLE_NAME = "orders";

    private final String tableName;
    private final ConcurrentHashMap<OrderId, Order> orders;
    private final ConcurrentSkipListMap<Long, ChangeEvent> pending;
    private final ConcurrentHashMap<String, Long> sequenceByEventId;
    private final AtomicLong sequence;
    private final AtomicInteger failingWrites;

    /**
     * Creates a store named {@value #DEFAULT_TABLE_NAME}.
     */
    public InMemoryOrderStore() {
        this(DEFAULT_TABLE_NAME);
    }

    /**
     * Creates a store.
     *
     * @param tableName logical table name
     * @throws IllegalArgumentException if tableName is null or blank
     */
    public InMemoryOrderStore(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            throw new IllegalArgumentException("tableName cannot be null or blank");
        }
        this.tableName = tableName;
        this.orders = new ConcurrentHashMap<>();
        this.pending = new ConcurrentSkipListMap<>();
        this.sequenceByEventId = new ConcurrentHashMap<>();
        this.sequence = new AtomicLong();
        this.failingWrites = new AtomicInteger();
    }

    @Override
    public Optional<Order> get(OrderId orderId) {
        if (orderId == null) {
            throw new IllegalArgumentException("orderId cannot be null");
        }
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public void put(Order order) {
        if (order == null) {
            throw new IllegalArgumentException("order cannot be null");
        }
        orders.put(order.orderId(), order);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Compare uses {@link Order#equals(Object)} on the full record</li>
     *   <li>The pending entry is added inside the same compute call as the write</li>
     *   <li>Throws {@link StoreException} while write failures are injected</li>
     * </ul>
     */
    @Override
    public boolean commit(Order expected, Order updated, ChangeEvent change) {
        if (expected == null || updated == null || change == null) {
            throw new IllegalArgumentException(
                "commit arguments cannot be null (expected: " + expected + ", updated: " + updated + ", change: " + change + ")");
        }
        OrderId orderId = expected.orderId();
        if (!orderId.equals(updated.orderId()) || !orderId.equals(change.orderId())) {
            throw new IllegalArgumentException("expected, updated and change must share one orderId: " + orderId);
        }
        if (consumeInjectedFailure()) {
            throw new StoreException("Injected write failure on table " + tableName + " for " + orderId);
        }

        AtomicBoolean written = new AtomicBoolean(false);
        orders.compute(orderId, (id, current) -> {
            if (current == null || !current.equals(expected)) {
                return current;
            }
            long seq = sequence.incrementAndGet();
            pending.put(seq, change);
            sequenceByEventId.put(change.eventId(), seq);
            written.set(true);
            return updated;
        });

        if (!written.get()) {
            log.debug("Conditional write rejected on {} for {}", tableName, orderId);
        }
        return written.get();
    }

    @Override
    public List<ChangeEvent> pendingChanges(OrderId orderId) {
        if (orderId == null) {
            throw new IllegalArgumentException("orderId cannot be null");
        }
        List<ChangeEvent> result = new ArrayList<>();
        for (ChangeEvent change : pending.values()) {
            if (change.orderId().equals(orderId)) {
                result.add(change);
            }
        }
        return result;
    }

    @Override
    public List<ChangeEvent> scanPending(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }
        List<ChangeEvent> result = new ArrayList<>();
        for (ChangeEvent change : pending.values()) {
            if (result.size() >= batchSize) {
                break;
            }
            result.add(change);
        }
        return result;
    }

    @Override
    public void markPublished(ChangeEvent change) {
        if (change == null) {
            throw new IllegalArgumentException("change cannot be null");
        }
        Long seq = sequenceByEventId.remove(change.eventId());
        if (seq != null) {
            pending.remove(seq);
        }
    }

    /**
     * Makes the next {@code count} commits throw {@link StoreException}. Used for testing.
     *
     * @param count number of failing commits
     */
    public void failNextWrites(int count) {
        failingWrites.set(count);
    }

    private boolean consumeInjectedFailure() {
        return failingWrites.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0;
    }

    /**
     * Clears all orders and pending changes. Used for test cleanup.
     */
    public void clear() {
        orders.clear();
        pending.clear();
        sequenceByEventId.clear();
        failingWrites.set(0);
    }

    public String getTableName() {
        return tableName;
    }

    /**
     * Returns the number of stored orders. Used for test assertions.
     *
     * @return order count
     */
    public int size() {
        return orders.size();
    }

    /**
     * Returns the number of pending changes. Used for test assertions.
     *
     * @return pending count
     */
    public int pendingSize() {
        return pending.size();
    }
}
