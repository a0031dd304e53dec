package com.nayem.courier.spring;

import java.util.List;

/**
 * Handler and middleware classes found on the classpath at startup.
 */
public record ScannedComponents(List<Class<?>> handlerTypes, List<Class<?>> middlewareTypes) {

    public ScannedComponents {
        handlerTypes = List.copyOf(handlerTypes);
        middlewareTypes = List.copyOf(middlewareTypes);
    }

    public static ScannedComponents empty() {
        return new ScannedComponents(List.of(), List.of());
    }
}
