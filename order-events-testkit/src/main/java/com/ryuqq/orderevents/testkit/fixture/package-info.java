/**
 * Test data builders shared by all modules.
 *
 * @since 1.0.0
 * @author Order Events Team
 */
package com.ryuqq.orderevents.testkit.fixture;
