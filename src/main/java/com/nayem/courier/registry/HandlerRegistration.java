package com.nayem.courier.registry;

/**
 * Read-only view of one registered handler, for diagnostics and tooling.
 */
public record HandlerRegistration(Class<?> messageType, HandlerDescriptor descriptor) {

    public String handlerName() {
        return descriptor.name();
    }

    public boolean isAsync() {
        return descriptor.isAsync();
    }

    public int order() {
        return descriptor.order();
    }

    @Override
    public String toString() {
        return String.format("Message: %s, Handler: %s, IsAsync: %s, Order: %d",
                messageType.getName(), handlerName(), isAsync(), order());
    }
}
