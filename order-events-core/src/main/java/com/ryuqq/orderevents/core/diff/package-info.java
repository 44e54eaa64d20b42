/**
 * Structural diff package.
 *
 * <ul>
 *   <li>{@link com.ryuqq.orderevents.core.diff.StructuralEquality} - Pure deep equality over JSON-shaped values</li>
 *   <li>{@link com.ryuqq.orderevents.core.diff.OrderDiff} - Changed top-level fields between two order states</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Order Events Team
 */
package com.ryuqq.orderevents.core.diff;
