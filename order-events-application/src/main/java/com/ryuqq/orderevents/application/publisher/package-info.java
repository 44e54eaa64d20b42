/**
 * OrderModified change event construction and publishing.
 *
 * @since 1.0.0
 * @author Order Events Team
 */
package com.ryuqq.orderevents.application.publisher;
