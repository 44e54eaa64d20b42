/**
 * In-memory {@link com.ryuqq.orderevents.core.spi.EventBus} implementation.
 *
 * @since 1.0.0
 * @author Order Events Team
 */
package com.ryuqq.orderevents.adapter.inmemory.bus;
