package com.nayem.courier.pipeline;

import com.nayem.courier.registry.MiddlewareDescriptor;

/**
 * A middleware descriptor paired with the instance acquired for one invocation.
 */
public record BoundMiddleware(MiddlewareDescriptor descriptor, Object instance) {
}
