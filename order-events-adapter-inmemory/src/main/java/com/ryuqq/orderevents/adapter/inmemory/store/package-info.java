/**
 * In-memory {@link com.ryuqq.orderevents.core.spi.OrderStore} implementation.
 *
 * <ul>
 *   <li>{@link com.ryuqq.orderevents.adapter.inmemory.store.InMemoryOrderStore} - Orders plus pending change log</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Order Events Team
 */
package com.ryuqq.orderevents.adapter.inmemory.store;
