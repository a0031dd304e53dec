package com.nayem.courier.exception;

/**
 * No handler is registered for a message passed to {@code invoke}.
 */
public class HandlerNotFoundException extends CourierException {

    private final Class<?> messageType;

    public HandlerNotFoundException(Class<?> messageType) {
        super("No handler found for message type " + messageType.getName());
        this.messageType = messageType;
    }

    public Class<?> getMessageType() {
        return messageType;
    }
}
