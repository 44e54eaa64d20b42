/**
 * Event contract package: inbound domain events and the outbound OrderModified event.
 *
 * <h2>Inbound</h2>
 * <ul>
 *   <li>{@link com.ryuqq.orderevents.core.contract.DomainEvent} - Raw envelope as delivered by the bus</li>
 *   <li>{@link com.ryuqq.orderevents.core.contract.NormalizedEvent} - Validated (detailType, orderId, payload) triple</li>
 *   <li>{@link com.ryuqq.orderevents.core.contract.EventPayload} - Parsed detail</li>
 *   <li>{@link com.ryuqq.orderevents.core.contract.OrderEventType} - Recognized warehouse and delivery events</li>
 * </ul>
 *
 * <h2>Outbound</h2>
 * <ul>
 *   <li>{@link com.ryuqq.orderevents.core.contract.ChangeEvent} - OrderModified envelope</li>
 *   <li>{@link com.ryuqq.orderevents.core.contract.ChangeDetail} - changed / old / new</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Order Events Team
 */
package com.ryuqq.orderevents.core.contract;
