/**
 * Handling outcome package.
 *
 * <p>{@link com.ryuqq.orderevents.core.outcome.HandlingOutcome} is the sealed result of one handler
 * invocation. The invoking runtime maps it onto the transport:</p>
 *
 * <pre>
 * Processed → ack
 * Ignored   → ack (intentionally dropped, not an error)
 * Retry     → redeliver (transient failure)
 * Fail      → dead-letter / drop (permanent failure)
 * </pre>
 *
 * @since 1.0.0
 * @author Order Events Team
 */
package com.ryuqq.orderevents.core.outcome;
