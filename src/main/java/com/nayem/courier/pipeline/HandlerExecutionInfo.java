package com.nayem.courier.pipeline;

import com.nayem.courier.registry.HandlerDescriptor;

/**
 * Identifies the handler a pipeline is running for.
 */
public record HandlerExecutionInfo(Class<?> handlerType, String handlerName, Class<?> messageType) {

    public static HandlerExecutionInfo of(HandlerDescriptor descriptor) {
        return new HandlerExecutionInfo(descriptor.handlerType(), descriptor.name(), descriptor.messageType());
    }
}
