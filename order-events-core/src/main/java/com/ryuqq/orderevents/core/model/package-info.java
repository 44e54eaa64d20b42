/**
 * Core domain model package: the persisted order aggregate and its value objects.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.orderevents.core.model.OrderId} - Order unique identifier (store primary key)</li>
 *   <li>{@link com.ryuqq.orderevents.core.model.OrderStatus} - Order lifecycle status</li>
 *   <li>{@link com.ryuqq.orderevents.core.model.Product} - Product line with opaque metadata</li>
 *   <li>{@link com.ryuqq.orderevents.core.model.Order} - Materialized order state</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Records with read-only collections; every change yields a new instance</li>
 *   <li><strong>Opaque attributes:</strong> Fields the core does not interpret pass through unchanged</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Order Events Team
 */
package com.ryuqq.orderevents.core.model;
