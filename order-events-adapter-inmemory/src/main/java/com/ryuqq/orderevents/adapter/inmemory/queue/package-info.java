/**
 * In-memory {@link com.ryuqq.orderevents.core.spi.EventQueue} implementation backed by a {@link java.util.concurrent.DelayQueue}.
 *
 * @since 1.0.0
 * @author Order Events Team
 */
package com.ryuqq.orderevents.adapter.inmemory.queue;
