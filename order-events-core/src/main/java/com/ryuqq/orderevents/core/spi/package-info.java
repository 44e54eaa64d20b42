/**
 * Service Provider Interfaces implemented by adapters.
 *
 * <h2>Ports</h2>
 * <ul>
 *   <li>{@link com.ryuqq.orderevents.core.spi.OrderStore} - Orders and pending change log</li>
 *   <li>{@link com.ryuqq.orderevents.core.spi.EventBus} - Outbound change notifications</li>
 *   <li>{@link com.ryuqq.orderevents.core.spi.EventQueue} - Inbound event deliveries</li>
 *   <li>{@link com.ryuqq.orderevents.core.spi.ConfigProvider} - Named configuration parameters</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Order Events Team
 */
package com.ryuqq.orderevents.core.spi;
