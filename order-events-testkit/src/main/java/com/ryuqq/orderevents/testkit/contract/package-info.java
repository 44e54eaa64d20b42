/**
 * Abstract SPI contract tests.
 *
 * <p>Adapter modules extend these classes and supply the implementation under test, so every
 * {@link com.ryuqq.orderevents.core.spi.OrderStore} and {@link com.ryuqq.orderevents.core.spi.EventQueue}
 * is checked against the same scenarios.</p>
 *
 * @since 1.0.0
 * @author Order Events Team
 */
package com.ryuqq.orderevents.testkit.contract;
