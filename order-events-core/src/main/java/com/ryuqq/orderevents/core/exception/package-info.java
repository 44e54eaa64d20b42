/**
 * Exception taxonomy for event processing.
 *
 * <p>All exceptions extend {@link com.ryuqq.orderevents.core.exception.OrderEventException},
 * which carries an error code and a retryable flag.</p>
 *
 * <h2>Non-retryable (log and drop)</h2>
 * <ul>
 *   <li>{@link com.ryuqq.orderevents.core.exception.MalformedEventException} - MALFORMED_EVENT</li>
 *   <li>{@link com.ryuqq.orderevents.core.exception.InvalidPayloadException} - INVALID_PAYLOAD</li>
 *   <li>{@link com.ryuqq.orderevents.core.exception.InvalidTransitionException} - INVALID_TRANSITION</li>
 * </ul>
 *
 * <h2>Retryable (redelivery requested)</h2>
 * <ul>
 *   <li>{@link com.ryuqq.orderevents.core.exception.StoreException} - STORE_WRITE_FAILED</li>
 *   <li>{@link com.ryuqq.orderevents.core.exception.ConcurrentUpdateException} - CONCURRENT_UPDATE</li>
 *   <li>{@link com.ryuqq.orderevents.core.exception.PublishException} - PUBLISH_FAILED</li>
 * </ul>
 *
 * <h2>Special cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.orderevents.core.exception.OrderNotFoundException} - retryable by configuration</li>
 *   <li>{@link com.ryuqq.orderevents.core.exception.UnsupportedEventException} - ignored, not an error</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Order Events Team
 */
package com.ryuqq.orderevents.core.exception;
