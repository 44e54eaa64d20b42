/**
 * Handler configuration and parameter-store loading.
 *
 * @since 1.0.0
 * @author Order Events Team
 */
package com.ryuqq.orderevents.application.config;
