package com.ryuqq.orderevents.core.spi;

import java.util.Optional;

/**
 * Named configuration parameter lookup (e.g. a parameter store).
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public interface ConfigProvider {

    /**
     * Looks up a parameter.
     *
     * @param name parameter name (e.g. /ecommerce/prod/orders/table/name)
     * @return the value, or empty if undefined
     * @throws IllegalArgumentException if name is null or blank
     */
    Optional<String> get(String name);
}
