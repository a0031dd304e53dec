package com.nayem.courier.core;

import com.nayem.courier.exception.ConstructionException;

/**
 * The dependency-injection container as seen by Courier.
 */
public interface ServiceLocator {

    /**
     * Locator for setups without a container. Every lookup fails.
     */
    ServiceLocator NONE = new ServiceLocator() {
        @Override
        public <T> T resolve(Class<T> type, ScopeContext scope) {
            throw new ConstructionException(type, "no service locator is configured");
        }

        @Override
        public <T> T resolveScoped(Class<T> type, ScopeContext scope) {
            throw new ConstructionException(type, "no service locator is configured");
        }
    };

    /**
     * Resolves a service by type, following the container's own lifetime rules.
     */
    <T> T resolve(Class<T> type, ScopeContext scope);

    /**
     * Resolves the instance bound to {@code scope}, creating it on first request within that scope.
     */
    <T> T resolveScoped(Class<T> type, ScopeContext scope);
}
