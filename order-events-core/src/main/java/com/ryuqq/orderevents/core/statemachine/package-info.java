/**
 * Order status state machine.
 *
 * <h2>Transitions</h2>
 * <p>Non-terminal statuses accept any target because warehouse and delivery events arrive unordered.
 * {@code FULFILLED} is terminal: only a re-delivered {@code DeliveryCompleted} is accepted, as a no-op.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.orderevents.core.statemachine.OrderStatusTransition} - Status rule validation</li>
 *   <li>{@link com.ryuqq.orderevents.core.statemachine.OrderTransitionEngine} - Applies a normalized event to an order</li>
 *   <li>{@link com.ryuqq.orderevents.core.statemachine.TransitionResult} - Pre/post images and changed fields</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Order Events Team
 */
package com.ryuqq.orderevents.core.statemachine;
