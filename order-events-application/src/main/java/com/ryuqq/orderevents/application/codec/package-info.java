/**
 * JSON envelope codec (Jackson tree model).
 *
 * @since 1.0.0
 * @author Order Events Team
 */
package com.ryuqq.orderevents.application.codec;
