/**
 * Event handling entry point.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.orderevents.application.handler.EventHandler} - Handler contract used by runtimes</li>
 *   <li>{@link com.ryuqq.orderevents.application.handler.OnEventsHandler} - Normalize, load, transition, persist, publish</li>
 *   <li>{@link com.ryuqq.orderevents.application.handler.HandlingStage} - Stage reached, logged on every outcome</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Order Events Team
 */
package com.ryuqq.orderevents.application.handler;
