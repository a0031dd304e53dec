package com.nayem.courier.exception;

import java.util.List;

/**
 * More than one handler is registered for a message passed to {@code invoke}.
 */
public class AmbiguousHandlerException extends CourierException {

    private final Class<?> messageType;
    private final List<String> handlers;

    public AmbiguousHandlerException(Class<?> messageType, List<String> handlers) {
        super(String.format("Multiple handlers found for message type %s: %s. Use publish for multiple handlers.",
                messageType.getName(), handlers));
        this.messageType = messageType;
        this.handlers = List.copyOf(handlers);
    }

    public Class<?> getMessageType() {
        return messageType;
    }

    public List<String> getHandlers() {
        return handlers;
    }
}
