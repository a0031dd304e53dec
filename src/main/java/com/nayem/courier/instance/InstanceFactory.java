package com.nayem.courier.instance;

import com.nayem.courier.core.ScopeContext;
import com.nayem.courier.core.ServiceLocator;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Creates the instance for a {@link com.nayem.courier.core.Lifetime#DEFAULT} handler or middleware.
 * Called at most once per successful construction; the result is cached by {@link InstanceCache}.
 */
@FunctionalInterface
public interface InstanceFactory {

    Object create(ServiceLocator locator, ScopeContext scope) throws Exception;

    static InstanceFactory of(Supplier<?> supplier) {
        Objects.requireNonNull(supplier, "supplier");
        return (locator, scope) -> supplier.get();
    }

    static InstanceFactory constant(Object instance) {
        Objects.requireNonNull(instance, "instance");
        return (locator, scope) -> instance;
    }

    /**
     * Constructor injection: the public constructor with the most parameters is called and each
     * parameter is resolved through the service locator.
     */
    static InstanceFactory reflective(Class<?> type) {
        return new ReflectiveInstanceFactory(type);
    }
}
