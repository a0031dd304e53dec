package com.nayem.courier.registry;

import com.nayem.courier.pipeline.MiddlewareContext;

/**
 * Calls the {@code before}, {@code after} or {@code onFinally} phase of a middleware.
 */
@FunctionalInterface
public interface PhaseInvoker {

    Object invoke(Object middleware, MiddlewareContext context) throws Exception;
}
