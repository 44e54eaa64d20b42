/**
 * In-memory {@link com.ryuqq.orderevents.core.spi.ConfigProvider} implementation.
 *
 * @since 1.0.0
 * @author Order Events Team
 */
package com.ryuqq.orderevents.adapter.inmemory.config;
