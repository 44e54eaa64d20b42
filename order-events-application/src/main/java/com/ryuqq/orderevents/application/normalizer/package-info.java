/**
 * Inbound event validation and payload parsing.
 *
 * @since 1.0.0
 * @author Order Events Team
 */
package com.ryuqq.orderevents.application.normalizer;
