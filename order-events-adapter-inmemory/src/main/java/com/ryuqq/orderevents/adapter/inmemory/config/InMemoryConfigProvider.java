package com.ryuqq.orderevents.adapter.inmemory.config;

import com.ryuqq.orderevents.core.spi.ConfigProvider;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory parameter store.
 *
 * <p>Names may contain the {@value #ENVIRONMENT_PLACEHOLDER} placeholder, which is replaced by the
 * environment given at construction before lookup, so
 * {@code /ecommerce/{Environment}/orders/table/name} resolves {@code /ecommerce/dev/orders/table/name}.</p>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public class InMemoryConfigProvider implements ConfigProvider {

    public static final String ENVIRONMENT_PLACEHOLDER = "{Environment}";

    private final String environment;
    private final ConcurrentHashMap<String, String> parameters;

    /**
     * Creates an empty provider.
     *
     * @param environment environment name (e.g. dev, prod)
     * @throws IllegalArgumentException if environment is null or blank
     */
    public InMemoryConfigProvider(String environment) {
        if (environment == null || environment.isBlank()) {
            throw new IllegalArgumentException("environment cannot be null or blank");
        }
        this.environment = environment;
        this.parameters = new ConcurrentHashMap<>();
    }

    @Override
    public Optional<String> get(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        return Optional.ofNullable(parameters.get(resolve(name)));
    }

    /**
     * Defines a parameter.
     *
     * @param name parameter name (placeholder allowed)
     * @param value parameter value
     * @return this provider
     * @throws IllegalArgumentException if name is blank or value is null
     */
    public InMemoryConfigProvider put(String name, String value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        parameters.put(resolve(name), value);
        return this;
    }

    /**
     * Replaces the environment placeholder.
     *
     * @param name parameter name
     * @return resolved name
     */
    public String resolve(String name) {
        return name.replace(ENVIRONMENT_PLACEHOLDER, environment);
    }

    public String getEnvironment() {
        return environment;
    }
}
