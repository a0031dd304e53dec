package com.nayem.courier.exception;

/**
 * Carries a checked exception thrown by handler or middleware code out of a synchronous call.
 * Unchecked exceptions are never wrapped.
 */
public class HandlerExecutionException extends CourierException {

    public HandlerExecutionException(Class<?> messageType, Throwable cause) {
        super("Handler for " + messageType.getName() + " failed: " + cause, cause);
    }
}
